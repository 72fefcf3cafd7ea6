package com.sqlframe.error;

public class DuplicateColumnNameException extends FrameQueryException {
    private final String columnName;

    public DuplicateColumnNameException(String columnName) {
        super("DUPLICATE_COLUMN", "Duplicate column name in result set: " + columnName);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
