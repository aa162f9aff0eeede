// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.pfive.speclib.util.ByteSize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.pfive.speclib.util.ByteSizeUtil.OBJECT_BYTES;
import static io.pfive.speclib.util.ByteSizeUtil.collectionFieldBytes;
import static io.pfive.speclib.util.ByteSizeUtil.valueBytes;

/// Stellar parameters for all stars in a library, one row per library entry, in library index
/// order. The index space of the table is the row position. Instances are immutable: appending a
/// row produces a new table, so a table handed to a library can never change underneath it.
///
/// Every row held by a table has exactly the columns of the table schema, in schema order, with
/// values converted to the column type. A row arriving with a column the table does not know
/// extends the schema, and earlier rows read as missing in that column.
public final class ParameterTable implements ByteSize {

    private final ImmutableMap<String, ColumnType> schema;
    private final ImmutableList<ParameterRow> rows;

    private ParameterTable (ImmutableMap<String, ColumnType> schema, ImmutableList<ParameterRow> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    /// A table with all required library columns and no rows.
    public static ParameterTable empty () {
        return new ParameterTable(LibraryColumns.REQUIRED, ImmutableList.of());
    }

    public static ParameterTable empty (Map<String, ColumnType> schema) {
        return new ParameterTable(ImmutableMap.copyOf(schema), ImmutableList.of());
    }

    /// Build a table with columns taken from the rows themselves, in the order they are first seen.
    /// Required columns get their library type; other column types are inferred from the first
    /// value present.
    public static ParameterTable of (List<ParameterRow> rows) {
        return of(ImmutableMap.of(), rows);
    }

    public static ParameterTable of (Map<String, ColumnType> schema, List<ParameterRow> rows) {
        Map<String, ColumnType> merged = new LinkedHashMap<>(schema);
        extendSchema(merged, rows);
        ImmutableMap<String, ColumnType> finalSchema = ImmutableMap.copyOf(merged);
        ImmutableList.Builder<ParameterRow> conformed = ImmutableList.builderWithExpectedSize(rows.size());
        for (ParameterRow row : rows) {
            conformed.add(conform(finalSchema, row));
        }
        return new ParameterTable(finalSchema, conformed.build());
    }

    public ImmutableMap<String, ColumnType> schema () {
        return schema;
    }

    public ImmutableSet<String> columns () {
        return schema.keySet();
    }

    public ColumnType columnType (String column) {
        return schema.get(column);
    }

    public int size () {
        return rows.size();
    }

    public boolean isEmpty () {
        return rows.isEmpty();
    }

    public ParameterRow row (int index) {
        return rows.get(index);
    }

    public ImmutableList<ParameterRow> rows () {
        return rows;
    }

    /// Returns a new table with the given row added at the end. An optional column that has not
    /// yet held any value takes its type from the first value it receives.
    /// @throws ColumnTypeException if a value does not fit the type of its column
    public ParameterTable appended (ParameterRow row) {
        Map<String, ColumnType> merged = new LinkedHashMap<>(schema);
        extendSchema(merged, List.of(row));
        retypeUnsetColumns(merged, row);
        ImmutableMap<String, ColumnType> newSchema = schema;
        ImmutableList<ParameterRow> oldRows = rows;
        if (!merged.equals(schema)) {
            newSchema = ImmutableMap.copyOf(merged);
            ImmutableList.Builder<ParameterRow> widened = ImmutableList.builderWithExpectedSize(rows.size() + 1);
            for (ParameterRow oldRow : rows) {
                widened.add(conform(newSchema, oldRow));
            }
            oldRows = widened.build();
        }
        ParameterRow conformed = conform(newSchema, row);
        ImmutableList<ParameterRow> newRows = ImmutableList.<ParameterRow>builderWithExpectedSize(oldRows.size() + 1)
              .addAll(oldRows)
              .add(conformed)
              .build();
        return new ParameterTable(newSchema, newRows);
    }

    /// Add to the schema any columns of the given rows it lacks. A new column takes its required
    /// library type, or the type of the first value present for it among the rows.
    private static void extendSchema (Map<String, ColumnType> schema, List<ParameterRow> rows) {
        Map<String, Object> firstValues = new LinkedHashMap<>();
        for (ParameterRow row : rows) {
            for (Map.Entry<String, Object> entry : row.asMap().entrySet()) {
                if (schema.containsKey(entry.getKey())) continue;
                Object seen = firstValues.get(entry.getKey());
                if (seen == null) firstValues.put(entry.getKey(), entry.getValue());
            }
        }
        firstValues.forEach((column, value) -> {
            ColumnType required = LibraryColumns.REQUIRED.get(column);
            schema.put(column, required != null ? required : ColumnType.forValue(value));
        });
    }

    private void retypeUnsetColumns (Map<String, ColumnType> merged, ParameterRow row) {
        for (Map.Entry<String, Object> entry : row.asMap().entrySet()) {
            String column = entry.getKey();
            Object value = entry.getValue();
            if (LibraryColumns.REQUIRED.containsKey(column) || !schema.containsKey(column)) continue;
            if (schema.get(column).accepts(value)) continue;
            boolean unset = rows.stream().allMatch(r -> r.value(column) == null);
            if (unset) merged.put(column, ColumnType.forValue(value));
        }
    }

    private static ParameterRow conform (Map<String, ColumnType> schema, ParameterRow row) {
        ParameterRow.Builder builder = ParameterRow.builder();
        for (Map.Entry<String, ColumnType> column : schema.entrySet()) {
            String name = column.getKey();
            builder.set(name, column.getValue().conform(name, row.value(name)));
        }
        return builder.build();
    }

    @Override
    public long byteSize () {
        return OBJECT_BYTES + collectionFieldBytes(rows,
              row -> OBJECT_BYTES + row.asMap().values().stream().mapToLong(v -> OBJECT_BYTES + valueBytes(v)).sum());
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterTable other)) return false;
        return schema.equals(other.schema) && rows.equals(other.rows);
    }

    @Override
    public int hashCode () {
        return Objects.hash(schema, rows);
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("nColumns", schema.size())
              .add("nRows", rows.size())
              .toString();
    }
}
