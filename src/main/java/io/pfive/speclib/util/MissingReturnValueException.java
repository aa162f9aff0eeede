// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.util;

/// Thrown when someone calls get() on an Err instead of an Ok variant of Ret. Callers that want
/// a more specific exception type use getOrThrow() instead.
public class MissingReturnValueException extends RuntimeException {
    public MissingReturnValueException (String message) {
        super(message);
    }
}
