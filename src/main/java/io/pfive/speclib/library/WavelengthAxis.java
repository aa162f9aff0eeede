// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import io.pfive.speclib.exception.RangeException;

import java.util.Arrays;

/// The wavelength of every sample, shared by all spectra in a library. Immutable.
public final class WavelengthAxis {

    private final double[] samples;

    private WavelengthAxis (double[] samples) {
        this.samples = samples;
    }

    public static WavelengthAxis of (double... samples) {
        return new WavelengthAxis(samples.clone());
    }

    /// Evenly spaced samples from start, with the given step.
    public static WavelengthAxis linear (double start, double step, int length) {
        double[] samples = new double[length];
        for (int i = 0; i < length; i++) {
            samples[i] = start + i * step;
        }
        return new WavelengthAxis(samples);
    }

    public int length () {
        return samples.length;
    }

    public double get (int index) {
        return samples[index];
    }

    public double[] toArray () {
        return samples.clone();
    }

    /// Find the positions of the samples strictly inside the limits, returned as the range from the
    /// first such position to one past the last. On a sorted axis that is exactly the samples inside
    /// the limits.
    /// @throws RangeException if no sample lies strictly inside the limits
    public SampleWindow window (WavelengthLimits limits) {
        int first = -1;
        int last = -1;
        for (int i = 0; i < samples.length; i++) {
            if (limits.contains(samples[i])) {
                if (first < 0) first = i;
                last = i;
            }
        }
        if (first < 0) {
            var message = String.format("No wavelength samples found between %s and %s.", limits.low(), limits.high());
            throw new RangeException(message);
        }
        return new SampleWindow(first, last + 1);
    }

    public WavelengthAxis slice (SampleWindow window) {
        return new WavelengthAxis(Arrays.copyOfRange(samples, window.from(), window.to()));
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof WavelengthAxis other)) return false;
        return Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(samples);
    }

    @Override
    public String toString () {
        if (samples.length == 0) return "WavelengthAxis[empty]";
        return String.format("WavelengthAxis[%d samples, %s to %s]", samples.length, samples[0], samples[samples.length - 1]);
    }
}
