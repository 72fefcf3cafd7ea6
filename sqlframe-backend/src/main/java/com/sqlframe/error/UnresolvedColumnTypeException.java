package com.sqlframe.error;

public class UnresolvedColumnTypeException extends FrameQueryException {
    private final String columnName;

    public UnresolvedColumnTypeException(String columnName, String typeName) {
        super("UNRESOLVED_COLUMN_TYPE", "No converter for column '" + columnName + "' of type '" + typeName + "'");
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
