// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import com.esotericsoftware.kryo.KryoException;
import io.pfive.speclib.exception.LibraryException;
import io.pfive.speclib.exception.LibraryFormatException;
import io.pfive.speclib.exception.LibraryIOException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/// Shared helpers for reading blocks of library files by absolute offset, and for mapping the
/// exceptions of the underlying libraries onto library exceptions.
abstract class FileBlocks {

    /// Read exactly length bytes starting at position, without moving the channel position.
    static byte[] readFully (FileChannel channel, Path path, long position, int length) throws IOException {
        if (position < 0 || length < 0 || position + length > channel.size()) {
            var message = String.format("Block of %d bytes at offset %d lies outside the file of %d bytes.",
                  length, position, channel.size());
            throw new LibraryFormatException(path, message);
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position + buffer.position());
            if (n < 0) {
                throw new LibraryFormatException(path, "Unexpected end of file.");
            }
        }
        return buffer.array();
    }

    /// Kryo reports both truncated input and failures of the wrapped stream as KryoException.
    static LibraryException translate (Path path, KryoException e) {
        if (e.getCause() instanceof IOException ioException) {
            return new LibraryIOException(path, ioException);
        }
        return new LibraryFormatException(path, e.getMessage(), e);
    }

    static int checkedInt (Path path, long value, String what) {
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new LibraryFormatException(path, String.format("Invalid %s: %d.", what, value));
        }
        return (int) value;
    }
}
