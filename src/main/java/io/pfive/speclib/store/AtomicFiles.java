// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import io.pfive.speclib.exception.LibraryIOException;
import io.pfive.speclib.util.RandomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/// Helpers for writing a file under a temporary name and then moving it over its destination, so
/// readers see either the old file or the complete new one. Temporary files go in the same
/// directory as their destination so the move stays within one filesystem.
public abstract class AtomicFiles {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    public static final String TEMP_SUFFIX = ".tmp";

    /// A path that does not yet exist, next to the given destination.
    public static Path tempSibling (Path destination) {
        Path fileName = destination.getFileName();
        String name = "." + fileName + "." + RandomId.createRandomStringId() + TEMP_SUFFIX;
        return destination.toAbsolutePath().resolveSibling(name);
    }

    /// Move the source over the destination, atomically where the filesystem allows it.
    public static void moveIntoPlace (Path source, Path destination) {
        try {
            try {
                Files.move(source, destination, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic move not supported for {}, replacing it non-atomically.", destination);
                Files.move(source, destination, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LibraryIOException(destination, e);
        }
    }

    /// Remove a leftover temporary file. Failure to remove it is logged rather than thrown, as this
    /// runs while another exception is already propagating.
    public static void deleteIfExists (Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                LOG.debug("Removed temporary file {}", path);
            }
        } catch (IOException e) {
            LOG.error("Could not remove temporary file {}", path, e);
        }
    }
}
