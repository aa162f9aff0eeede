// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

/// One star of a library: its parameters together with its spectrum and uncertainty.
public record LibraryEntry(ParameterRow parameters, SpectrumPair spectrum) {

    public int libIndex () {
        return parameters.libIndex().orElse(-1);
    }
}
