// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

/// Common supertype of the eagerly checked construction and insertion failures.
public abstract class ValidationException extends LibraryException {
    public ValidationException (String message) {
        super(message);
    }
}
