// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConfigurationTest {

    @Test
    void bundledProperties_matchStorageDefaults () {
        assertThat(Configuration.CHUNK_TARGET_BYTES).isEqualTo(100_000);
        assertThat(Configuration.COMPRESSION_LEVEL).isEqualTo(1);
        assertThat(Configuration.SHUFFLE).isTrue();
        assertThat(Configuration.ATOMIC_SAVE).isTrue();
    }

    @Test
    void absentKey_fallsBackToDefault () {
        assertThat(Configuration.intVal("no-such-key", 7)).isEqualTo(7);
        assertThat(Configuration.boolVal("no-such-key", false)).isFalse();
    }

    @Test
    void malformedValue_namesTheKey () {
        Configuration.properties.setProperty("test-malformed", "lots");
        try {
            assertThatThrownBy(() -> Configuration.intVal("test-malformed", 1))
                  .hasMessageContaining("test-malformed");
            assertThatThrownBy(() -> Configuration.boolVal("test-malformed", true))
                  .hasMessageContaining("test-malformed");
        } finally {
            Configuration.properties.remove("test-malformed");
        }
    }
}
