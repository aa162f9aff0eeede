// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

public class SchemaException extends ValidationException {

    private final String column;

    public SchemaException (String column, String context) {
        super(String.format("Column '%s' required in %s.", column, context));
        this.column = column;
    }

    /// The name of the missing column.
    public String column () {
        return column;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.SCHEMA;
    }
}
