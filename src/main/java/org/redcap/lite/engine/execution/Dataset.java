package org.redcap.lite.engine.execution;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.redcap.lite.column.RedcapValueArray;
import org.redcap.lite.column.RowMask;
import org.redcap.lite.column.ValueMismatchException;
import org.redcap.lite.types.RedcapValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A materialized study-data table: named columns of raw response strings,
 * all of the same length.
 *
 * The typed view of a column ({@link RedcapValueArray}) is built on first
 * use and kept for the lifetime of the dataset. Raw data is never modified.
 */
public final class Dataset {

    private static final Logger LOG = LoggerFactory.getLogger(Dataset.class);

    private final Map<String, ImmutableList<String>> rawColumns;
    private final int rowCount;
    private final RedcapValues values;
    private final ConcurrentMap<String, RedcapValueArray> columns = new ConcurrentHashMap<>();

    private Dataset(Map<String, ImmutableList<String>> rawColumns, int rowCount, RedcapValues values) {
        this.rawColumns = Collections.unmodifiableMap(rawColumns);
        this.rowCount = rowCount;
        this.values = values;
    }

    // ========================================
    // Construction
    // ========================================

    public static Dataset fromColumns(Map<String, ? extends List<String>> columns) {
        return fromColumns(columns, RedcapValues.defaults());
    }

    /**
     * Builds a dataset from columns keyed by field name; iteration order of
     * the map becomes the field order.
     *
     * @throws ValueMismatchException if the columns differ in length
     */
    public static Dataset fromColumns(Map<String, ? extends List<String>> columns, RedcapValues values) {
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        Map<String, ImmutableList<String>> raw = new LinkedHashMap<>();
        int rowCount = -1;
        for (Map.Entry<String, ? extends List<String>> entry : columns.entrySet()) {
            List<String> column = entry.getValue();
            if (rowCount < 0) {
                rowCount = column.size();
            } else if (column.size() != rowCount) {
                throw new ValueMismatchException("Dataset column '" + entry.getKey() + "'", rowCount, column.size());
            }
            raw.put(entry.getKey(), Lists.immutable.withAll(column));
        }
        return new Dataset(raw, Math.max(rowCount, 0), values);
    }

    public static Dataset fromRows(List<String> header, List<? extends List<String>> rows) {
        return fromRows(header, rows, RedcapValues.defaults());
    }

    /**
     * Builds a dataset from a header and rows, the shape of a CSV export.
     *
     * @throws ValueMismatchException   if a row's length differs from the header's
     * @throws IllegalArgumentException if the header repeats a field name
     */
    public static Dataset fromRows(List<String> header, List<? extends List<String>> rows, RedcapValues values) {
        Objects.requireNonNull(header, "Header cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        List<List<String>> columns = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            columns.add(new ArrayList<>(rows.size()));
        }
        int rowNumber = 0;
        for (List<String> row : rows) {
            if (row.size() != header.size()) {
                throw new ValueMismatchException("Dataset row " + rowNumber, header.size(), row.size());
            }
            for (int i = 0; i < row.size(); i++) {
                columns.get(i).add(row.get(i));
            }
            rowNumber++;
        }
        Map<String, List<String>> byName = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            if (byName.put(header.get(i), columns.get(i)) != null) {
                throw new IllegalArgumentException("Duplicate field in header: " + header.get(i));
            }
        }
        return fromColumns(byName, values);
    }

    // ========================================
    // Access
    // ========================================

    public int rowCount() {
        return rowCount;
    }

    public Set<String> fieldNames() {
        return rawColumns.keySet();
    }

    public boolean hasField(String field) {
        return rawColumns.containsKey(field);
    }

    public ImmutableList<String> rawColumn(String field) {
        ImmutableList<String> column = rawColumns.get(field);
        if (column == null) {
            throw new UnknownFieldException(Set.of(field));
        }
        return column;
    }

    /**
     * Typed view of a column, classified on first access.
     *
     * @throws UnknownFieldException if the field does not exist
     */
    public RedcapValueArray column(String field) {
        ImmutableList<String> raw = rawColumn(field);
        return columns.computeIfAbsent(field, name -> {
            LOG.debug("Materializing column '{}' ({} rows)", name, rowCount);
            return RedcapValueArray.of(raw.castToList(), values);
        });
    }

    /**
     * @return the rows selected by the mask, in order, as a new dataset
     * @throws ValueMismatchException if the mask length differs from the row count
     */
    public Dataset filter(RowMask mask) {
        if (mask.size() != rowCount) {
            throw new ValueMismatchException("Dataset filter", rowCount, mask.size());
        }
        ImmutableIntList selected = mask.selectedIndices();
        Map<String, ImmutableList<String>> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, ImmutableList<String>> entry : rawColumns.entrySet()) {
            ImmutableList<String> column = entry.getValue();
            filtered.put(entry.getKey(), Lists.immutable.withAll(selected.collect(column::get)));
        }
        return new Dataset(filtered, selected.size(), values);
    }

    @Override
    public String toString() {
        return "Dataset" + rawColumns.keySet() + " (" + rowCount + " rows)";
    }
}
