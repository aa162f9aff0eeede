// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

import java.nio.file.Path;

/// The file could be read but does not contain what a parameter file or spectrum file should.
public class LibraryFormatException extends LibraryException {
    public LibraryFormatException (Path path, String message) {
        super(String.format("Malformed library file %s: %s", path, message));
    }

    public LibraryFormatException (Path path, String message, Throwable cause) {
        super(String.format("Malformed library file %s: %s", path, message), cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.FORMAT;
    }
}
