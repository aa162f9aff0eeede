// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.util;

import java.util.Collection;
import java.util.Locale;
import java.util.function.ToLongFunction;

/// Various static helper functions to assist in computing the memory consumption of class instances.
/// Typically used by implementations of the [ByteSize] interface.
public abstract class ByteSizeUtil {

    public static final int OBJECT_BYTES = 16;
    public static final int ARRAY_BYTES = OBJECT_BYTES + 8;
    public static final int OBJECT_REFERENCE_BYTES = 6;

    private static final String[] UNITS = {"B", "kB", "MB", "GB", "TB"};

    public static long doubleArrayFieldBytes (double[] array) {
        if (array == null) return OBJECT_REFERENCE_BYTES;
        return OBJECT_REFERENCE_BYTES + doubleArrayBytes(array.length);
    }

    public static long doubleArrayBytes (long length) {
        return length * Double.BYTES + ARRAY_BYTES;
    }

    public static <T> long collectionFieldBytes (Collection<T> items, ToLongFunction<T> byteSizeEstimator) {
        if (items == null) return OBJECT_REFERENCE_BYTES;
        long bytes = OBJECT_REFERENCE_BYTES + ARRAY_BYTES + (long) items.size() * OBJECT_REFERENCE_BYTES;
        for (T item : items) if (item != null) bytes += byteSizeEstimator.applyAsLong(item);
        return bytes;
    }

    /// Rough size of a boxed scalar or string value as held in a parameter row.
    public static long valueBytes (Object value) {
        if (value == null) return 0;
        if (value instanceof String s) return OBJECT_BYTES + ARRAY_BYTES + s.length();
        return OBJECT_BYTES + Long.BYTES;
    }

    /// Format a number of bytes with decimal (SI) units, e.g. 1.2 MB.
    public static String human (long bytes) {
        if (bytes < 1000) return bytes + " B";
        double value = bytes;
        int unit = 0;
        while (value >= 1000 && unit < UNITS.length - 1) {
            value /= 1000;
            unit += 1;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }

    public static double proportionFinite (double[] array) {
        if (array.length == 0) return 1;
        double nFinite = 0;
        for (double d : array) if (Double.isFinite(d)) nFinite += 1;
        return nFinite / array.length;
    }

    public static int percentFinite (double[] array) {
        return (int) (proportionFinite(array) * 100.0);
    }
}
