package com.sqlframe.source;

import com.sqlframe.convert.ColumnMetadata;
import com.sqlframe.convert.NativeKind;
import com.sqlframe.convert.NativeValue;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link RowSource} over a JDBC result set, or over every result set an executed statement produced.
 *
 * <p>Does not close the statement or its result sets.
 */
public class JdbcRowSource implements RowSource {

    private final Statement statement;
    private ResultSet resultSet;
    private int[] sqlTypes;
    private String[] typeNames;

    private JdbcRowSource(Statement statement, ResultSet resultSet) {
        this.statement = statement;
        this.resultSet = Objects.requireNonNull(resultSet, "resultSet");
    }

    public static JdbcRowSource forResultSet(ResultSet resultSet) {
        return new JdbcRowSource(null, resultSet);
    }

    /**
     * Source over an executed statement, starting at its current result set.
     *
     * @throws SQLException if the statement has no result set
     */
    public static JdbcRowSource forStatement(Statement statement) throws SQLException {
        ResultSet first = statement.getResultSet();
        if (first == null) {
            throw new SQLException("Statement did not produce a result set");
        }
        return new JdbcRowSource(statement, first);
    }

    @Override
    public List<ColumnMetadata> columns() throws SQLException {
        ResultSetMetaData md = resultSet.getMetaData();
        int count = md.getColumnCount();
        List<ColumnMetadata> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(new ColumnMetadata(
                    md.getColumnLabel(i),
                    md.getColumnTypeName(i),
                    JdbcValues.scanKindFor(md.getColumnType(i))));
        }
        return columns;
    }

    @Override
    public boolean next() throws SQLException {
        return resultSet.next();
    }

    @Override
    public List<NativeValue> read(List<NativeKind> scanKinds) throws SQLException {
        if (sqlTypes == null) {
            loadDeclaredTypes();
        }
        List<NativeValue> row = new ArrayList<>(scanKinds.size());
        for (int i = 0; i < scanKinds.size(); i++) {
            // JDBC uses 1-based column indexing.
            row.add(JdbcValues.read(resultSet, i + 1, scanKinds.get(i), sqlTypes[i], typeNames[i]));
        }
        return row;
    }

    private void loadDeclaredTypes() throws SQLException {
        ResultSetMetaData md = resultSet.getMetaData();
        int count = md.getColumnCount();
        sqlTypes = new int[count];
        typeNames = new String[count];
        for (int i = 0; i < count; i++) {
            sqlTypes[i] = md.getColumnType(i + 1);
            typeNames[i] = md.getColumnTypeName(i + 1);
        }
    }

    @Override
    public boolean nextResultSet() throws SQLException {
        if (statement == null) {
            return false;
        }
        while (true) {
            if (statement.getMoreResults()) {
                resultSet = statement.getResultSet();
                sqlTypes = null;
                typeNames = null;
                return true;
            }
            if (statement.getUpdateCount() == -1) {
                return false;
            }
        }
    }
}
