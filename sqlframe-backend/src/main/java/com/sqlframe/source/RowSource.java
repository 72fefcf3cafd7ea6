package com.sqlframe.source;

import com.sqlframe.convert.ColumnMetadata;
import com.sqlframe.convert.NativeKind;
import com.sqlframe.convert.NativeValue;

import java.sql.SQLException;
import java.util.List;

/**
 * Cursor over one or more result sets.
 *
 * <p>The caller owns the source and releases it; the frame builder only reads from it.
 */
public interface RowSource {

    /**
     * Columns of the current result set, available before the first {@link #next()}.
     */
    List<ColumnMetadata> columns() throws SQLException;

    /**
     * Advances to the next row of the current result set.
     *
     * @return false once the result set is exhausted
     */
    boolean next() throws SQLException;

    /**
     * Reads the current row, scanning column {@code i} as {@code scanKinds.get(i)}.
     *
     * <p>A column scanned as {@link NativeKind#OTHER} is read untyped and tagged with its runtime kind.
     */
    List<NativeValue> read(List<NativeKind> scanKinds) throws SQLException;

    /**
     * Moves to the next result set.
     *
     * @return false when there are no further result sets
     */
    boolean nextResultSet() throws SQLException;
}
