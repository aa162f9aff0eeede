// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

/// Lower and upper wavelength bounds used to restrict which samples are read from a spectrum
/// file. Both bounds are exclusive.
public record WavelengthLimits(double low, double high) {

    public WavelengthLimits {
        if (!(low < high)) {
            throw new IllegalArgumentException(
                  String.format("Lower wavelength limit %s must be less than upper limit %s.", low, high));
        }
    }

    public boolean contains (double wavelength) {
        return wavelength > low && wavelength < high;
    }
}
