// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/// Converts chunks of double values to and from their stored bytes: little-endian IEEE 754,
/// optionally byte-shuffled, then optionally zlib-deflated.
/// A negative compression level means the bytes are stored uncompressed.
public record ChunkCodec(boolean shuffle, int compressionLevel) {

    public static final ChunkCodec RAW = new ChunkCodec(false, -1);

    public ChunkCodec {
        if (compressionLevel > 9) {
            throw new IllegalArgumentException("Compression level must be at most 9, was " + compressionLevel);
        }
    }

    public boolean compressed () {
        return compressionLevel >= 0;
    }

    public byte[] encode (double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asDoubleBuffer().put(values);
        byte[] bytes = buffer.array();
        if (shuffle) bytes = ByteShuffle.shuffle(bytes, Double.BYTES);
        if (compressed()) bytes = deflate(bytes, compressionLevel);
        return bytes;
    }

    /// @throws DataFormatException if the bytes do not inflate to exactly nValues doubles
    public double[] decode (byte[] stored, int nValues) throws DataFormatException {
        int nBytes = nValues * Double.BYTES;
        byte[] bytes = compressed() ? inflate(stored, nBytes) : stored;
        if (bytes.length != nBytes) {
            throw new DataFormatException(String.format("Expected %d bytes in chunk, found %d.", nBytes, bytes.length));
        }
        if (shuffle) bytes = ByteShuffle.unshuffle(bytes, Double.BYTES);
        double[] values = new double[nValues];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer().get(values);
        return values;
    }

    public static int checksum (byte[] stored) {
        CRC32 crc = new CRC32();
        crc.update(stored);
        return (int) crc.getValue();
    }

    private static byte[] deflate (byte[] bytes, int level) {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(bytes);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, bytes.length / 2));
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate (byte[] stored, int expectedBytes) throws DataFormatException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(stored);
            // One spare byte so that overlong data is detected rather than truncated.
            byte[] out = new byte[expectedBytes + 1];
            int n = 0;
            while (!inflater.finished()) {
                int got = inflater.inflate(out, n, out.length - n);
                if (got == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Compressed chunk ended early.");
                }
                n += got;
                if (n > expectedBytes) {
                    throw new DataFormatException(String.format("Chunk inflates to more than the expected %d bytes.", expectedBytes));
                }
            }
            if (n != expectedBytes) {
                throw new DataFormatException(String.format("Chunk inflated to %d bytes, expected %d.", n, expectedBytes));
            }
            return Arrays.copyOf(out, expectedBytes);
        } finally {
            inflater.end();
        }
    }
}
