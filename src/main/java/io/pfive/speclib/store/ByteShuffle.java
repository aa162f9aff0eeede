// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

/// Byte shuffle filter: regroups an array of fixed-size elements so that byte 0 of every element
/// comes first, then byte 1 of every element, and so on. Floating point samples of a smooth
/// spectrum share their sign, exponent and high mantissa bytes, so shuffled data deflates better.
public abstract class ByteShuffle {

    public static byte[] shuffle (byte[] in, int elementSize) {
        checkLength(in, elementSize);
        int n = in.length / elementSize;
        byte[] out = new byte[in.length];
        for (int e = 0; e < n; e++) {
            for (int b = 0; b < elementSize; b++) {
                out[b * n + e] = in[e * elementSize + b];
            }
        }
        return out;
    }

    public static byte[] unshuffle (byte[] in, int elementSize) {
        checkLength(in, elementSize);
        int n = in.length / elementSize;
        byte[] out = new byte[in.length];
        for (int e = 0; e < n; e++) {
            for (int b = 0; b < elementSize; b++) {
                out[e * elementSize + b] = in[b * n + e];
            }
        }
        return out;
    }

    private static void checkLength (byte[] in, int elementSize) {
        if (in.length % elementSize != 0) {
            throw new IllegalArgumentException(
                  String.format("%d bytes is not a whole number of %d-byte elements.", in.length, elementSize));
        }
    }
}
