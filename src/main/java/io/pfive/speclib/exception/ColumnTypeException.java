// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

/// A parameter value that cannot be held in the type of its column, such as a string in a
/// numeric column.
public class ColumnTypeException extends ValidationException {

    private final String column;

    public ColumnTypeException (String column, String message) {
        super(message);
        this.column = column;
    }

    public String column () {
        return column;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.SCHEMA;
    }
}
