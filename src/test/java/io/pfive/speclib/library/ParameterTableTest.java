// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import io.pfive.speclib.exception.ColumnTypeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.pfive.speclib.library.LibraryFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ParameterTableTest {

    @Test
    void empty_hasRequiredColumnsInOrder () {
        ParameterTable table = ParameterTable.empty();

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.columns()).containsExactlyElementsOf(LibraryColumns.NAMES);
        assertThat(table.columnType(LibraryColumns.LIB_INDEX)).isEqualTo(ColumnType.INTEGER);
        assertThat(table.columnType(LibraryColumns.TEFF)).isEqualTo(ColumnType.REAL);
        assertThat(table.columnType(LibraryColumns.SOURCE)).isEqualTo(ColumnType.STRING);
    }

    @Test
    void appended_returnsNewTableAndLeavesOriginal () {
        ParameterTable empty = ParameterTable.empty();

        ParameterTable one = empty.appended(star(0).withLibIndex(0));

        assertThat(empty.size()).isZero();
        assertThat(one.size()).isEqualTo(1);
        assertThat(one.row(0).libIndex()).hasValue(0);
    }

    @Test
    void appended_withUnknownColumn_extendsSchema () {
        ParameterTable table = ParameterTable.empty().appended(star(0).withLibIndex(0));

        ParameterTable extended = table.appended(star(1).withLibIndex(1).with("snr", 120.5));

        assertThat(extended.columns()).endsWith("snr");
        assertThat(extended.columnType("snr")).isEqualTo(ColumnType.REAL);
        assertThat(extended.row(0).has("snr")).isTrue();
        assertThat(extended.row(0).value("snr")).isNull();
        assertThat(extended.row(1).getDouble("snr")).isEqualTo(120.5);
    }

    @Test
    void of_infersExtraColumnTypeFromFirstValuePresent () {
        ParameterRow first = star(0).withLibIndex(0).with("n_obs", null);
        ParameterRow second = star(1).withLibIndex(1).with("n_obs", 4);

        ParameterTable table = ParameterTable.of(List.of(first, second));

        assertThat(table.columnType("n_obs")).isEqualTo(ColumnType.INTEGER);
        assertThat(table.row(1).value("n_obs")).isEqualTo(4L);
    }

    @Test
    void of_widensIntegersInRealColumns () {
        ParameterRow row = star(0).withLibIndex(0).with(LibraryColumns.TEFF, 5800);

        ParameterTable table = ParameterTable.of(List.of(row));

        assertThat(table.row(0).value(LibraryColumns.TEFF)).isEqualTo(5800.0);
    }

    @Test
    void of_rejectsStringInRealColumn () {
        ParameterRow row = star(0).withLibIndex(0).with(LibraryColumns.FEH, "solar");

        assertThatThrownBy(() -> ParameterTable.of(List.of(row)))
              .isInstanceOf(ColumnTypeException.class)
              .hasMessageContaining("feh");
    }

    @Test
    void appended_columnWithOnlyMissingValues_takesTypeOfFirstValue () {
        ParameterTable table = ParameterTable.empty()
              .appended(star(0).withLibIndex(0).with("kmag", null))
              .appended(star(1).withLibIndex(1).with("kmag", 5.5));

        assertThat(table.columnType("kmag")).isEqualTo(ColumnType.REAL);
        assertThat(table.row(0).value("kmag")).isNull();
        assertThat(table.row(1).getDouble("kmag")).isEqualTo(5.5);
    }

    @Test
    void appended_columnHoldingValues_keepsItsType () {
        ParameterTable table = ParameterTable.empty().appended(star(0).withLibIndex(0).with("note", "binary"));

        assertThatThrownBy(() -> table.appended(star(1).withLibIndex(1).with("note", 3)))
              .isInstanceOf(ColumnTypeException.class)
              .hasMessageContaining("note");
    }

    @Test
    void rows_holdEveryColumnOfTheSchema () {
        ParameterRow sparse = ParameterRow.builder().set(LibraryColumns.LIB_INDEX, 0).set(LibraryColumns.CPS_NAME, "HD1").build();

        ParameterTable table = ParameterTable.of(ParameterTable.empty().schema(), List.of(sparse));

        assertThat(table.row(0).columns()).containsExactlyElementsOf(LibraryColumns.NAMES);
        assertThat(table.row(0).getDouble(LibraryColumns.LOGG)).isNaN();
    }
}
