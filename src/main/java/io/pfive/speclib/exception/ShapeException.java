// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

public class ShapeException extends ValidationException {
    public ShapeException (String message) {
        super(message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.SHAPE;
    }
}
