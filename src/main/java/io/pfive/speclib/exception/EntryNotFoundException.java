// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

/// Thrown by indexed access for a library index that has no entry.
public class EntryNotFoundException extends LibraryException {
    public EntryNotFoundException (String message) {
        super(message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.LOOKUP;
    }
}
