package com.sqlframe.source;

import com.sqlframe.convert.ColumnMetadata;
import com.sqlframe.convert.NativeKind;
import com.sqlframe.convert.NativeValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory {@link RowSource} over pre-materialized rows, one or more result sets.
 *
 * <p>Cells are raw Java objects, with null standing for SQL NULL.
 */
public class ListRowSource implements RowSource {

    private final List<ResultSetData> resultSets = new ArrayList<>();
    private int current;
    private int cursor = -1;
    private int reads;

    private ListRowSource() {
    }

    public static ListRowSource of(List<ColumnMetadata> columns, List<List<Object>> rows) {
        return new ListRowSource().andThen(columns, rows);
    }

    /**
     * Appends another result set.
     */
    public ListRowSource andThen(List<ColumnMetadata> columns, List<List<Object>> rows) {
        resultSets.add(new ResultSetData(List.copyOf(columns), new ArrayList<>(rows)));
        return this;
    }

    public static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }

    /**
     * Number of rows handed out through {@link #read(List)} so far, across all result sets.
     */
    public int getReads() {
        return reads;
    }

    @Override
    public List<ColumnMetadata> columns() {
        return resultSets.get(current).columns;
    }

    @Override
    public boolean next() {
        List<List<Object>> rows = resultSets.get(current).rows;
        if (cursor + 1 >= rows.size()) {
            cursor = rows.size();
            return false;
        }
        cursor++;
        return true;
    }

    @Override
    public List<NativeValue> read(List<NativeKind> scanKinds) {
        List<List<Object>> rows = resultSets.get(current).rows;
        if (cursor < 0 || cursor >= rows.size()) {
            throw new IllegalStateException("cursor is not on a row");
        }
        List<Object> raw = rows.get(cursor);
        List<NativeValue> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Object v = raw.get(i);
            NativeKind kind = i < scanKinds.size() ? scanKinds.get(i) : NativeKind.OTHER;
            if (v == null) {
                out.add(NativeValue.absent(kind));
            } else if (kind == NativeKind.OTHER) {
                out.add(NativeValue.of(v));
            } else {
                out.add(NativeValue.present(kind, v));
            }
        }
        reads++;
        return out;
    }

    @Override
    public boolean nextResultSet() {
        if (current + 1 >= resultSets.size()) {
            return false;
        }
        current++;
        cursor = -1;
        return true;
    }

    private static final class ResultSetData {
        private final List<ColumnMetadata> columns;
        private final List<List<Object>> rows;

        private ResultSetData(List<ColumnMetadata> columns, List<List<Object>> rows) {
            this.columns = columns;
            this.rows = rows;
        }
    }
}
