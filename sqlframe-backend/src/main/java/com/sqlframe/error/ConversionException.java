package com.sqlframe.error;

/**
 * Thrown when a row cannot be read or a value cannot be converted into its frame field.
 *
 * <p>The frame under construction is discarded.
 */
public class ConversionException extends FrameQueryException {
    private final String columnName;
    private final String typeName;
    private final long rowIndex;

    public ConversionException(String columnName, String typeName, long rowIndex, Throwable cause) {
        super("CONVERSION_FAILED", buildMessage(columnName, typeName, rowIndex, cause), cause);
        this.columnName = columnName;
        this.typeName = typeName;
        this.rowIndex = rowIndex;
    }

    private static String buildMessage(String columnName, String typeName, long rowIndex, Throwable cause) {
        String reason = cause != null ? cause.getMessage() : null;
        if (columnName == null) {
            return "Failed to read row " + rowIndex + ": " + reason;
        }
        return "Failed to convert column '" + columnName + "' (" + typeName + ") at row " + rowIndex + ": " + reason;
    }

    /**
     * Column name, or null when the row itself could not be read.
     */
    public String getColumnName() {
        return columnName;
    }

    public String getTypeName() {
        return typeName;
    }

    public long getRowIndex() {
        return rowIndex;
    }
}
