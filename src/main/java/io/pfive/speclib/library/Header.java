// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Free-form metadata stored with a library, such as its creation date. Keys are strings and
/// values are scalars: String, Boolean, Long or Double (other boxed numbers are widened to those).
/// Each library owns its own Header instance, copied from whatever the caller supplied.
public final class Header {

    public static final String DATE_CREATED = "date_created";

    private final LinkedHashMap<String, Object> entries = new LinkedHashMap<>();

    public Header () { }

    public static Header of (Map<String, ?> values) {
        Header header = new Header();
        values.forEach(header::put);
        return header;
    }

    public Header copy () {
        return Header.of(entries);
    }

    /// @throws IllegalArgumentException if the value is null or not a scalar
    public Header put (String key, Object value) {
        Objects.requireNonNull(key, "header key");
        entries.put(key, normalize(key, value));
        return this;
    }

    public Object get (String key) {
        return entries.get(key);
    }

    public String getString (String key) {
        Object value = entries.get(key);
        return value == null ? null : value.toString();
    }

    public boolean containsKey (String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys () {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size () {
        return entries.size();
    }

    public Map<String, Object> asMap () {
        return Collections.unmodifiableMap(entries);
    }

    /// Record the given day as the creation date, in ISO form (yyyy-MM-dd), replacing any earlier one.
    public void stampCreated (LocalDate date) {
        entries.put(DATE_CREATED, date.toString());
    }

    private static Object normalize (String key, Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        String type = value == null ? "null" : value.getClass().getName();
        throw new IllegalArgumentException(String.format("Header value for '%s' must be a scalar, not %s.", key, type));
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof Header other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode () {
        return entries.hashCode();
    }

    @Override
    public String toString () {
        return "Header" + entries;
    }
}
