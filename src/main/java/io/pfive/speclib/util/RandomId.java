// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.util;

import java.util.UUID;

public abstract class RandomId {
    /// This ID should not be case-sensitive as it is used in filenames (temporary files written
    /// next to their final destination) on filesystems that may not be case-sensitive.
    public static String createRandomStringId () {
        return UUID.randomUUID().toString().replaceAll("-", "");
    }
}
