// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

/// How a stored array of shape (nEntries, depth, nSamples) is cut into chunks. Every chunk spans
/// all entries and all planes, and a run of consecutive samples along the last axis, so reading a
/// wavelength window touches only the chunks overlapping it. The last chunk may be shorter.
/// One-dimensional arrays use nEntries = depth = 1.
public record ChunkLayout(int nEntries, int depth, int nSamples, int chunkSamples) {

    public ChunkLayout {
        if (nEntries < 0 || depth < 0 || nSamples < 0 || chunkSamples < 0) {
            throw new IllegalArgumentException("Negative dimension in chunk layout.");
        }
        if (nSamples > 0 && (chunkSamples < 1 || chunkSamples > nSamples)) {
            throw new IllegalArgumentException(
                  String.format("Chunk length %d must be in [1, %d].", chunkSamples, nSamples));
        }
    }

    /// Choose the chunk length so that one uncompressed chunk is about targetBytes long. That is
    /// targetBytes divided by the size of one sample column across all entries and planes, rounded
    /// down and kept between 1 and nSamples. With no entries a column is empty, and the whole
    /// axis goes in one chunk.
    public static ChunkLayout forTargetBytes (int nEntries, int depth, int nSamples, int targetBytes) {
        long columnBytes = (long) nEntries * depth * Double.BYTES;
        int chunkSamples;
        if (nSamples == 0) {
            chunkSamples = 0;
        } else if (columnBytes == 0) {
            chunkSamples = nSamples;
        } else {
            long fit = targetBytes / columnBytes;
            chunkSamples = (int) Math.max(1, Math.min(nSamples, fit));
        }
        return new ChunkLayout(nEntries, depth, nSamples, chunkSamples);
    }

    /// A single chunk covering a whole one-dimensional array.
    public static ChunkLayout single (int length) {
        return new ChunkLayout(1, 1, length, length);
    }

    public int chunkCount () {
        if (nSamples == 0) return 0;
        return (nSamples + chunkSamples - 1) / chunkSamples;
    }

    public int chunkStart (int chunk) {
        return chunk * chunkSamples;
    }

    public int chunkEnd (int chunk) {
        return Math.min(nSamples, (chunk + 1) * chunkSamples);
    }

    public int chunkForSample (int sample) {
        return sample / chunkSamples;
    }

    /// Number of values in the given chunk.
    public int chunkValues (int chunk) {
        return nEntries * depth * (chunkEnd(chunk) - chunkStart(chunk));
    }

    @Override
    public String toString () {
        return String.format("(%d, %d, %d)", nEntries, depth, chunkSamples);
    }
}
