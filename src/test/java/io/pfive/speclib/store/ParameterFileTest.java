// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import com.esotericsoftware.kryo.io.Output;
import io.pfive.speclib.exception.LibraryFormatException;
import io.pfive.speclib.exception.LibraryIOException;
import io.pfive.speclib.library.ColumnType;
import io.pfive.speclib.library.LibraryColumns;
import io.pfive.speclib.library.ParameterRow;
import io.pfive.speclib.library.ParameterTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.pfive.speclib.library.LibraryFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ParameterFileTest {

    @TempDir
    Path tempDir;

    @Test
    void write_thenRead_preservesRowsAndMissingValues () {
        ParameterTable table = ParameterTable.of(indexedStars(5));
        Path path = tempDir.resolve("params.bin");

        ParameterFile.write(path, table);
        ParameterTable read = ParameterFile.read(path);

        assertThat(read).isEqualTo(table);
        assertThat(read.row(1).value(LibraryColumns.MASS)).isNull();
        assertThat(read.row(1).getDouble(LibraryColumns.AGE)).isNaN();
    }

    @Test
    void reader_readsSingleRows () {
        ParameterTable table = ParameterTable.of(indexedStars(6));
        Path path = tempDir.resolve("params.bin");
        ParameterFile.write(path, table);

        try (ParameterFile.Reader reader = ParameterFile.open(path)) {
            assertThat(reader.rowCount()).isEqualTo(6);
            assertThat(reader.schema()).isEqualTo(table.schema());
            assertThat(reader.readRow(4)).isEqualTo(table.row(4));
            assertThat(reader.readRow(0)).isEqualTo(table.row(0));
            assertThatThrownBy(() -> reader.readRow(6)).isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Test
    void extraColumns_keepTheirTypes () {
        ParameterRow row = star(0).withLibIndex(0).with("n_obs", 3).with("notes", "binary?").with("snr", null);
        ParameterTable table = ParameterTable.of(java.util.List.of(row));
        Path path = tempDir.resolve("params.bin");

        ParameterFile.write(path, table);
        ParameterTable read = ParameterFile.read(path);

        assertThat(read.columnType("n_obs")).isEqualTo(ColumnType.INTEGER);
        assertThat(read.columnType("notes")).isEqualTo(ColumnType.STRING);
        assertThat(read.columns()).containsExactlyElementsOf(table.columns());
        assertThat(read.row(0).value("n_obs")).isEqualTo(3L);
    }

    @Test
    void emptyTable_roundTrips () {
        Path path = tempDir.resolve("params.bin");

        ParameterFile.write(path, ParameterTable.empty());

        assertThat(ParameterFile.read(path)).isEqualTo(ParameterTable.empty());
    }

    @Test
    void read_notAParameterFile_throwsFormatException () throws IOException {
        Path path = tempDir.resolve("params.bin");
        Files.write(path, "lib_index,cps_name\n0,HD1\n".getBytes(StandardCharsets.US_ASCII));

        assertThatThrownBy(() -> ParameterFile.read(path))
              .isInstanceOf(LibraryFormatException.class)
              .hasMessageContaining(path.toString());
    }

    @Test
    void read_truncatedFile_throwsFormatException () throws IOException {
        Path path = tempDir.resolve("params.bin");
        ParameterFile.write(path, ParameterTable.of(indexedStars(3)));
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, java.util.Arrays.copyOf(bytes, 20));

        assertThatThrownBy(() -> ParameterFile.read(path)).isInstanceOf(LibraryFormatException.class);
    }

    @Test
    void read_rowCountLargerThanFile_throwsFormatException () throws IOException {
        Path path = tempDir.resolve("params.bin");
        try (Output out = new Output(Files.newOutputStream(path))) {
            out.writeBytes("SPECPAR1".getBytes(StandardCharsets.US_ASCII));
            out.writeVarInt(1, true);
            out.writeString(ParameterFile.TABLE_NAME);
            out.writeVarInt(0, true);
            out.writeInt(Integer.MAX_VALUE - 16);
        }

        assertThatThrownBy(() -> ParameterFile.read(path))
              .isInstanceOf(LibraryFormatException.class)
              .hasMessageContaining("Row count");
    }

    @Test
    void read_missingFile_throwsIOException () {
        Path path = tempDir.resolve("absent.bin");

        assertThatThrownBy(() -> ParameterFile.read(path))
              .isInstanceOf(LibraryIOException.class)
              .hasCauseInstanceOf(IOException.class);
    }
}
