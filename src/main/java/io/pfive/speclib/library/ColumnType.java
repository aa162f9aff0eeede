// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import io.pfive.speclib.exception.ColumnTypeException;

/// Storage type of one column of a ParameterTable. Every type admits a missing value, held as
/// null. The code is the byte written for the column in a parameter file.
public enum ColumnType {
    INTEGER(1), REAL(2), STRING(3);

    public final byte code;

    ColumnType (int code) {
        this.code = (byte) code;
    }

    public static ColumnType forCode (int code) {
        for (ColumnType type : values()) {
            if (type.code == code) return type;
        }
        throw new IllegalArgumentException("Unknown column type code: " + code);
    }

    /// Infer the type of a column that first appears with the given value. A column first seen
    /// holding only a missing value is assumed to hold strings.
    public static ColumnType forValue (Object value) {
        if (value == null || value instanceof String) return STRING;
        if (isIntegral(value)) return INTEGER;
        if (value instanceof Number) return REAL;
        throw new IllegalArgumentException("Unsupported parameter value type: " + value.getClass().getName());
    }

    /// Convert a value to the canonical boxed type stored for this column: Long, Double or String.
    /// Integral numbers are widened into REAL columns. Nothing else is coerced.
    /// @throws ColumnTypeException naming the column if the value cannot be held
    public Object conform (String column, Object value) {
        if (value == null) return null;
        if (!accepts(value)) {
            var message = String.format("Value %s of type %s does not fit %s column '%s'.",
                  value, value.getClass().getSimpleName(), this, column);
            throw new ColumnTypeException(column, message);
        }
        return switch (this) {
            case INTEGER -> ((Number) value).longValue();
            case REAL -> ((Number) value).doubleValue();
            case STRING -> value;
        };
    }

    /// True if the value is missing or can be held in a column of this type.
    public boolean accepts (Object value) {
        if (value == null) return true;
        return switch (this) {
            case INTEGER -> isIntegral(value);
            case REAL -> value instanceof Number;
            case STRING -> value instanceof String;
        };
    }

    private static boolean isIntegral (Object value) {
        return value instanceof Long || value instanceof Integer
              || value instanceof Short || value instanceof Byte;
    }
}
