// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

import java.io.IOException;
import java.nio.file.Path;

/// Unchecked wrapper for an IOException while reading or writing a library file. Nothing is
/// retried; the caller decides whether to try again.
public class LibraryIOException extends LibraryException {
    public LibraryIOException (Path path, IOException cause) {
        super(String.format("I/O failure on %s: %s", path, cause.getMessage()), cause);
    }

    @Override
    public synchronized IOException getCause () {
        return (IOException) super.getCause();
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.IO;
    }
}
