package com.sqlframe.error;

import java.time.Instant;

public class NonMonotonicTimeException extends FrameQueryException {
    private final int rowIndex;

    public NonMonotonicTimeException(String fieldName, int rowIndex, Instant previous, Instant current) {
        super("NON_MONOTONIC_TIME", "Time field '" + fieldName + "' is not ascending at row " + rowIndex
                + ": " + current + " follows " + previous);
        this.rowIndex = rowIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
