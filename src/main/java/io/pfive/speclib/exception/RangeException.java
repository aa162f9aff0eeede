// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

/// An index outside the entries of a library, or a wavelength window that selects no samples.
public class RangeException extends ValidationException {
    public RangeException (String message) {
        super(message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.RANGE;
    }
}
