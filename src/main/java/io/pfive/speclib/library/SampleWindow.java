// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

/// Half-open range [from, to) of positions on the wavelength axis.
public record SampleWindow(int from, int to) {

    public SampleWindow {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException(String.format("Invalid sample window [%d, %d).", from, to));
        }
    }

    public int length () {
        return to - from;
    }
}
