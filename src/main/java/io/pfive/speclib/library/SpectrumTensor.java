// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import com.google.common.base.MoreObjects;
import io.pfive.speclib.exception.ShapeException;
import io.pfive.speclib.util.ByteSize;

import java.util.Arrays;
import java.util.List;

import static io.pfive.speclib.util.ByteSizeUtil.OBJECT_BYTES;
import static io.pfive.speclib.util.ByteSizeUtil.doubleArrayFieldBytes;
import static io.pfive.speclib.util.ByteSizeUtil.percentFinite;

/// Three-axis array of spectra with shape (nEntries, depth, nSamples), held as a single flat
/// array in row-major order. In a well-formed library depth is 2: plane 0 is flux and plane 1 is
/// flux uncertainty. Other depths can be represented so that a library can reject them.
/// Instances are immutable, appending an entry produces a new tensor.
public final class SpectrumTensor implements ByteSize {

    public static final int FLUX = 0;
    public static final int UNCERTAINTY = 1;
    public static final int PAIR_DEPTH = 2;

    private final int nEntries;
    private final int depth;
    private final int nSamples;
    private final double[] data;

    private SpectrumTensor (int nEntries, int depth, int nSamples, double[] data) {
        this.nEntries = nEntries;
        this.depth = depth;
        this.nSamples = nSamples;
        this.data = data;
    }

    /// A tensor of shape (0, 2, nSamples).
    public static SpectrumTensor empty (int nSamples) {
        return new SpectrumTensor(0, PAIR_DEPTH, nSamples, new double[0]);
    }

    /// A tensor holding a copy of a flat row-major array.
    /// @throws ShapeException if the array length does not match the shape
    public static SpectrumTensor of (int nEntries, int depth, int nSamples, double[] data) {
        if (nEntries < 0 || depth < 0 || nSamples < 0) {
            throw new ShapeException(String.format("Negative dimension in shape (%d, %d, %d).", nEntries, depth, nSamples));
        }
        long expected = (long) nEntries * depth * nSamples;
        if (data.length != expected) {
            var message = String.format("Array of %d values cannot have shape (%d, %d, %d).",
                  data.length, nEntries, depth, nSamples);
            throw new ShapeException(message);
        }
        return new SpectrumTensor(nEntries, depth, nSamples, data.clone());
    }

    /// Copy a nested array, which must be rectangular.
    public static SpectrumTensor of (double[][][] array) {
        int n = array.length;
        int d = n == 0 ? PAIR_DEPTH : array[0].length;
        int w = (n == 0 || d == 0) ? 0 : array[0][0].length;
        double[] data = new double[n * d * w];
        int p = 0;
        for (int i = 0; i < n; i++) {
            if (array[i].length != d) {
                throw new ShapeException(String.format("Entry %d has %d planes, expected %d.", i, array[i].length, d));
            }
            for (int j = 0; j < d; j++) {
                if (array[i][j].length != w) {
                    var message = String.format("Entry %d plane %d has %d samples, expected %d.", i, j, array[i][j].length, w);
                    throw new ShapeException(message);
                }
                System.arraycopy(array[i][j], 0, data, p, w);
                p += w;
            }
        }
        return new SpectrumTensor(n, d, w, data);
    }

    /// Stack flux and uncertainty pairs into a tensor of shape (pairs.size(), 2, nSamples).
    public static SpectrumTensor ofPairs (int nSamples, List<SpectrumPair> pairs) {
        SpectrumTensor tensor = empty(nSamples);
        for (SpectrumPair pair : pairs) {
            tensor = tensor.appended(pair);
        }
        return tensor;
    }

    public int nEntries () {
        return nEntries;
    }

    public int depth () {
        return depth;
    }

    public int nSamples () {
        return nSamples;
    }

    public int[] shape () {
        return new int[] {nEntries, depth, nSamples};
    }

    public String shapeString () {
        return String.format("(%d, %d, %d)", nEntries, depth, nSamples);
    }

    public double get (int entry, int plane, int sample) {
        return data[offset(entry, plane) + sample];
    }

    /// A copy of one plane (flux or uncertainty) of one entry.
    public double[] plane (int entry, int plane) {
        int from = offset(entry, plane);
        return Arrays.copyOfRange(data, from, from + nSamples);
    }

    /// A copy of the flux and uncertainty of one entry. Only valid when depth is 2.
    public SpectrumPair pair (int entry) {
        if (depth != PAIR_DEPTH) {
            throw new IllegalStateException("Tensor of shape " + shapeString() + " does not hold flux and uncertainty pairs.");
        }
        return new SpectrumPair(plane(entry, FLUX), plane(entry, UNCERTAINTY));
    }

    /// Returns a new tensor with one more entry at the end. Only valid when depth is 2.
    /// @throws ShapeException if either array differs in length from the sample axis
    public SpectrumTensor appended (SpectrumPair pair) {
        if (depth != PAIR_DEPTH) {
            throw new IllegalStateException("Cannot append flux and uncertainty to a tensor of shape " + shapeString());
        }
        checkLength("spectrum", pair.flux());
        checkLength("spectrum uncertainty", pair.uncertainty());
        double[] grown = Arrays.copyOf(data, data.length + PAIR_DEPTH * nSamples);
        System.arraycopy(pair.flux(), 0, grown, data.length, nSamples);
        System.arraycopy(pair.uncertainty(), 0, grown, data.length + nSamples, nSamples);
        return new SpectrumTensor(nEntries + 1, depth, nSamples, grown);
    }

    private void checkLength (String name, double[] values) {
        if (values.length != nSamples) {
            var message = String.format("Length of %s (%d) does not match the library wavelength array (%d).",
                  name, values.length, nSamples);
            throw new ShapeException(message);
        }
    }

    /// Returns a new tensor holding only samples [window.from, window.to) of every plane.
    public SpectrumTensor sliceSamples (SampleWindow window) {
        return new SpectrumTensor(nEntries, depth, window.length(), copySamples(window.from(), window.to()));
    }

    /// Copy samples [from, to) of every plane of every entry, in row-major order of the shape
    /// (nEntries, depth, to - from). This is the layout of one stored chunk.
    public double[] copySamples (int from, int to) {
        int width = to - from;
        double[] out = new double[nEntries * depth * width];
        int p = 0;
        for (int row = 0; row < nEntries * depth; row++) {
            System.arraycopy(data, row * nSamples + from, out, p, width);
            p += width;
        }
        return out;
    }

    /// A copy of all values in row-major order.
    public double[] toFlatArray () {
        return data.clone();
    }

    private int offset (int entry, int plane) {
        if (entry < 0 || entry >= nEntries) {
            throw new IndexOutOfBoundsException("Entry " + entry + " outside tensor of shape " + shapeString());
        }
        return (entry * depth + plane) * nSamples;
    }

    @Override
    public long byteSize () {
        return OBJECT_BYTES + 3 * Integer.BYTES + doubleArrayFieldBytes(data);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof SpectrumTensor other)) return false;
        return nEntries == other.nEntries && depth == other.depth && nSamples == other.nSamples
              && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode () {
        return 31 * Arrays.hashCode(shape()) + Arrays.hashCode(data);
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("shape", shapeString())
              .add("finitePct", percentFinite(data))
              .add("memBytes", humanByteSize())
              .toString();
    }
}
