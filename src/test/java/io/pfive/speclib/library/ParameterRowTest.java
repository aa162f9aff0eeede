// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ParameterRowTest {

    @Test
    void withRequiredColumns_hasAllColumnsMissing () {
        ParameterRow row = ParameterRow.withRequiredColumns().build();

        assertThat(row.columns()).containsExactlyElementsOf(LibraryColumns.NAMES);
        assertThat(row.libIndex()).isEmpty();
        assertThat(row.getDouble(LibraryColumns.TEFF)).isNaN();
        assertThat(row.getString(LibraryColumns.CPS_NAME)).isNull();
    }

    @Test
    void withLibIndex_returnsCopy () {
        ParameterRow row = ParameterRow.withRequiredColumns().set(LibraryColumns.CPS_NAME, "HD 10700").build();

        ParameterRow indexed = row.withLibIndex(12);

        assertThat(indexed.libIndex()).hasValue(12);
        assertThat(row.libIndex()).isEmpty();
        assertThat(indexed.getString(LibraryColumns.CPS_NAME)).isEqualTo("HD 10700");
    }

    @Test
    void equality_ignoresBoxedNumberType () {
        ParameterRow ints = ParameterRow.of(Map.of("lib_index", 3, "Teff", 5700f));
        ParameterRow longs = ParameterRow.of(Map.of("lib_index", 3L, "Teff", 5700.0));

        assertThat(ints).isEqualTo(longs);
        assertThat(ints.hashCode()).isEqualTo(longs.hashCode());
    }

    @Test
    void getDouble_onStringColumn_throws () {
        ParameterRow row = ParameterRow.builder().set("source", "Mann").build();

        assertThatThrownBy(() -> row.getDouble("source"))
              .isInstanceOf(IllegalStateException.class)
              .hasMessageContaining("source");
    }

    @Test
    void set_rejectsNonScalarValues () {
        assertThatThrownBy(() -> ParameterRow.builder().set("spectrum", new double[3]))
              .isInstanceOf(IllegalArgumentException.class);
    }
}
