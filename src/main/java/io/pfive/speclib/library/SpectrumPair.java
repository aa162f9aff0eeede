// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import java.util.Arrays;

/// The flux of one library spectrum and its per-sample uncertainty, both sampled on the library
/// wavelength axis. As with other array-holding records, the arrays are not copied on the way in
/// or out. Pairs returned by a library are always fresh copies of its data.
public record SpectrumPair(double[] flux, double[] uncertainty) {

    public int length () {
        return flux.length;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof SpectrumPair other)) return false;
        return Arrays.equals(flux, other.flux) && Arrays.equals(uncertainty, other.uncertainty);
    }

    @Override
    public int hashCode () {
        return 31 * Arrays.hashCode(flux) + Arrays.hashCode(uncertainty);
    }

    @Override
    public String toString () {
        return String.format("SpectrumPair[%d samples]", flux.length);
    }
}
