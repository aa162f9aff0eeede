// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.exception;

/// Superclass for all exceptions raised by the spectral library and its file formats. Each carries
/// an ErrorType so callers can branch on the kind of failure without catching every subclass.
/// Validation failures are detected before any state is mutated, so catching one of these leaves
/// the library exactly as it was before the call.
public abstract class LibraryException extends RuntimeException {

    public LibraryException (String message) {
        super(message);
    }

    public LibraryException (String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType errorType ();

    public enum ErrorType {
        /// A required column is missing from a parameter table or row.
        SCHEMA,
        /// Lengths or array dimensions disagree.
        SHAPE,
        /// An index or wavelength window falls outside the data.
        RANGE,
        /// No entry exists at the requested library index.
        LOOKUP,
        /// A file exists but its contents are not a valid library file.
        FORMAT,
        /// The underlying file could not be read or written.
        IO
    }
}
