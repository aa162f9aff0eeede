// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/// Yes, this is global state and it's intentional.
/// Storage tunables are readily available everywhere and fixed for the life of the JVM. Anything
/// that needs to vary them (mostly tests) passes explicit SpectrumFile.Options instead.
/// Values come from the classpath resource speclib.properties. Keys absent from that resource (or
/// the whole resource being absent) fall back to the defaults below.
public abstract class Configuration {
    public static final String RESOURCE_NAME = "speclib.properties";
    public static final Properties properties = new Properties();

    /// Target size in bytes of one compressed chunk of library spectra, before compression.
    public static final int CHUNK_TARGET_BYTES;
    /// Deflate compression level for library spectra, 0-9.
    public static final int COMPRESSION_LEVEL;
    public static final boolean SHUFFLE;
    /// Write both library files to temporary files and move them into place when complete.
    public static final boolean ATOMIC_SAVE;

    static {
        try (InputStream in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
            CHUNK_TARGET_BYTES = intVal("chunk-target-bytes", 100_000);
            COMPRESSION_LEVEL = intVal("compression-level", 1);
            SHUFFLE = boolVal("shuffle", true);
            ATOMIC_SAVE = boolVal("atomic-save", true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stringVal (String key) {
        String val = properties.getProperty(key);
        return val == null ? null : val.strip();
    }

    static int intVal (String key, int defaultValue) {
        String val = stringVal(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new RuntimeException(message, e);
        }
    }

    static boolean boolVal (String key, boolean defaultValue) {
        String val = stringVal(key);
        if (val == null) return defaultValue;
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new RuntimeException(message);
    }

}
