// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.google.common.collect.ImmutableMap;
import gnu.trove.list.TLongList;
import gnu.trove.list.array.TLongArrayList;
import io.pfive.speclib.exception.LibraryFormatException;
import io.pfive.speclib.exception.LibraryIOException;
import io.pfive.speclib.library.ColumnType;
import io.pfive.speclib.library.ParameterRow;
import io.pfive.speclib.library.ParameterTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Saves and loads a library parameter table as a self-describing binary file. The file holds one
/// named table: its column names and types, a table of row offsets, and the rows. The offsets
/// allow any single row to be read without reading the others.
///
/// Layout, using Kryo Output encodings:
/// - magic bytes "SPECPAR1"
/// - varint format version
/// - string table name
/// - varint column count, then per column a string name and a one byte type code
/// - int row count, then one long absolute file offset per row
/// - rows, each being per column a presence byte (0 = missing) and a value if present: varlong
///   for INTEGER, double for REAL, string for STRING
public abstract class ParameterFile {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String TABLE_NAME = "library_params";
    private static final byte[] MAGIC = "SPECPAR1".getBytes(StandardCharsets.US_ASCII);
    private static final int VERSION = 1;

    /// Write the table to the given path, replacing any existing file.
    public static void write (Path path, ParameterTable table) {
        ImmutableMap<String, ColumnType> schema = table.schema();
        int nRows = table.size();
        // Rows are encoded up front so their offsets are known before any of them is written.
        List<byte[]> encodedRows = new ArrayList<>(nRows);
        for (ParameterRow row : table.rows()) {
            encodedRows.add(encodeRow(schema, row));
        }
        try (Output out = new Output(Files.newOutputStream(path))) {
            out.writeBytes(MAGIC);
            out.writeVarInt(VERSION, true);
            out.writeString(TABLE_NAME);
            out.writeVarInt(schema.size(), true);
            for (Map.Entry<String, ColumnType> column : schema.entrySet()) {
                out.writeString(column.getKey());
                out.writeByte(column.getValue().code);
            }
            out.writeInt(nRows);
            long offset = out.total() + (long) Long.BYTES * nRows;
            for (byte[] encoded : encodedRows) {
                out.writeLong(offset);
                offset += encoded.length;
            }
            for (byte[] encoded : encodedRows) {
                out.writeBytes(encoded);
            }
        } catch (IOException e) {
            throw new LibraryIOException(path, e);
        } catch (KryoException e) {
            throw FileBlocks.translate(path, e);
        }
        LOG.debug("Wrote {} parameter rows with {} columns to {}.", nRows, schema.size(), path);
    }

    /// Read the whole table from the given path.
    public static ParameterTable read (Path path) {
        try (Reader reader = open(path)) {
            return reader.readTable();
        }
    }

    public static Reader open (Path path) {
        return new Reader(path);
    }

    private static byte[] encodeRow (Map<String, ColumnType> schema, ParameterRow row) {
        Output out = new Output(256, -1);
        for (Map.Entry<String, ColumnType> column : schema.entrySet()) {
            Object value = row.value(column.getKey());
            if (value == null) {
                out.writeByte(0);
                continue;
            }
            out.writeByte(1);
            switch (column.getValue()) {
                case INTEGER -> out.writeVarLong((Long) value, false);
                case REAL -> out.writeDouble((Double) value);
                case STRING -> out.writeString((String) value);
            }
        }
        return out.toBytes();
    }

    /// Random access to the rows of one parameter file. Holds the file open until closed.
    public static class Reader implements Closeable {

        private final Path path;
        private final FileChannel channel;
        private final ImmutableMap<String, ColumnType> schema;
        private final TLongList rowOffsets;
        private final long endOfRows;

        private Reader (Path path) {
            this.path = path;
            try (Input in = new Input(Files.newInputStream(path))) {
                byte[] magic = in.readBytes(MAGIC.length);
                if (!Arrays.equals(magic, MAGIC)) {
                    throw new LibraryFormatException(path, "Not a library parameter file.");
                }
                int version = in.readVarInt(true);
                if (version != VERSION) {
                    throw new LibraryFormatException(path, "Unsupported parameter file version " + version);
                }
                String tableName = in.readString();
                if (!TABLE_NAME.equals(tableName)) {
                    throw new LibraryFormatException(path, String.format("Expected table '%s', found '%s'.", TABLE_NAME, tableName));
                }
                int nColumns = in.readVarInt(true);
                Map<String, ColumnType> columns = new LinkedHashMap<>();
                for (int c = 0; c < nColumns; c++) {
                    String name = in.readString();
                    byte code = in.readByte();
                    try {
                        columns.put(name, ColumnType.forCode(code));
                    } catch (IllegalArgumentException e) {
                        throw new LibraryFormatException(path, e.getMessage(), e);
                    }
                }
                schema = ImmutableMap.copyOf(columns);
                int nRows = FileBlocks.checkedInt(path, in.readInt(), "row count");
                endOfRows = Files.size(path);
                if ((long) nRows * Long.BYTES > endOfRows - in.total()) {
                    var message = String.format("Row count %d needs more offsets than the file of %d bytes holds.", nRows, endOfRows);
                    throw new LibraryFormatException(path, message);
                }
                rowOffsets = new TLongArrayList(nRows);
                for (int r = 0; r < nRows; r++) {
                    rowOffsets.add(in.readLong());
                }
                // Position of the first row, which is also where rows end if there are none.
                long firstRow = in.total();
                long previous = firstRow;
                for (int r = 0; r < nRows; r++) {
                    long offset = rowOffsets.get(r);
                    if (offset < previous || offset > endOfRows) {
                        throw new LibraryFormatException(path, String.format("Row %d has invalid offset %d.", r, offset));
                    }
                    previous = offset;
                }
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            } catch (KryoException e) {
                throw FileBlocks.translate(path, e);
            }
            try {
                channel = FileChannel.open(path, StandardOpenOption.READ);
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            }
        }

        public ImmutableMap<String, ColumnType> schema () {
            return schema;
        }

        public int rowCount () {
            return rowOffsets.size();
        }

        /// Read one row, without reading any of the others.
        public ParameterRow readRow (int index) {
            if (index < 0 || index >= rowOffsets.size()) {
                throw new IndexOutOfBoundsException(
                      String.format("Row %d requested from parameter file with %d rows.", index, rowOffsets.size()));
            }
            long start = rowOffsets.get(index);
            long end = index + 1 < rowOffsets.size() ? rowOffsets.get(index + 1) : endOfRows;
            try {
                byte[] bytes = FileBlocks.readFully(channel, path, start, FileBlocks.checkedInt(path, end - start, "row length"));
                return decodeRow(bytes, index);
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            } catch (KryoException e) {
                throw FileBlocks.translate(path, e);
            }
        }

        public ParameterTable readTable () {
            List<ParameterRow> rows = new ArrayList<>(rowCount());
            for (int r = 0; r < rowCount(); r++) {
                rows.add(readRow(r));
            }
            return ParameterTable.of(schema, rows);
        }

        private ParameterRow decodeRow (byte[] bytes, int index) {
            Input in = new Input(bytes);
            ParameterRow.Builder row = ParameterRow.builder();
            for (Map.Entry<String, ColumnType> column : schema.entrySet()) {
                byte present = in.readByte();
                Object value = null;
                if (present == 1) {
                    value = switch (column.getValue()) {
                        case INTEGER -> in.readVarLong(false);
                        case REAL -> in.readDouble();
                        case STRING -> in.readString();
                    };
                } else if (present != 0) {
                    throw new LibraryFormatException(path, String.format("Row %d has an invalid presence flag.", index));
                }
                row.set(column.getKey(), value);
            }
            if (in.position() != bytes.length) {
                throw new LibraryFormatException(path, String.format("Row %d has %d unexpected trailing bytes.", index, bytes.length - in.position()));
            }
            return row.build();
        }

        @Override
        public void close () {
            try {
                channel.close();
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            }
        }
    }
}
