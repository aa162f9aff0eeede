// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

import static io.pfive.speclib.library.LibraryColumns.LIB_INDEX;

/// Stellar parameters for one library star: an ordered, immutable mapping from column name to
/// value. A column can be present with a missing value (null), which is different from the column
/// being absent altogether. Values are Long, Double or String. Derived rows are made with the
/// with* methods, which return copies and leave this row unchanged.
public final class ParameterRow {

    private final Map<String, Object> values;

    private ParameterRow (LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder () {
        return new Builder();
    }

    /// Start a row that has every required library column, all of them missing.
    public static Builder withRequiredColumns () {
        Builder builder = new Builder();
        for (String name : LibraryColumns.NAMES) {
            builder.set(name, null);
        }
        return builder;
    }

    public static ParameterRow of (Map<String, ?> values) {
        Builder builder = new Builder();
        values.forEach(builder::set);
        return builder.build();
    }

    public Set<String> columns () {
        return values.keySet();
    }

    public boolean has (String column) {
        return values.containsKey(column);
    }

    /// Returns the value in the given column, or null if it is missing or the column is absent.
    public Object value (String column) {
        return values.get(column);
    }

    /// Numeric value of a column, with missing values (and absent columns) reported as NaN.
    public double getDouble (String column) {
        Object value = values.get(column);
        if (value == null) return Double.NaN;
        if (value instanceof Number number) return number.doubleValue();
        throw new IllegalStateException(String.format("Column '%s' holds a string, not a number.", column));
    }

    public String getString (String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public OptionalInt libIndex () {
        Object value = values.get(LIB_INDEX);
        if (value instanceof Number number) return OptionalInt.of(number.intValue());
        return OptionalInt.empty();
    }

    /// Returns a copy of this row with the given library index and every other value unchanged.
    public ParameterRow withLibIndex (int libIndex) {
        return with(LIB_INDEX, (long) libIndex);
    }

    public ParameterRow with (String column, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, normalize(value));
        return new ParameterRow(copy);
    }

    public Map<String, Object> asMap () {
        return values;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterRow other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode () {
        return Objects.hash(values);
    }

    @Override
    public String toString () {
        return "ParameterRow" + values;
    }

    /// Boxed integral types are held as Long and floats as Double, so that equality does not
    /// depend on which boxed type a caller happened to use.
    private static Object normalize (Object value) {
        if (value == null || value instanceof String || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported parameter value type: " + value.getClass().getName());
    }

    public static class Builder {
        private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

        private Builder () { }

        public Builder set (String column, Object value) {
            Objects.requireNonNull(column, "column name");
            values.put(column, normalize(value));
            return this;
        }

        public ParameterRow build () {
            return new ParameterRow(new LinkedHashMap<>(values));
        }
    }
}
