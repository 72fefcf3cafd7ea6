package com.sqlframe.resample;

public enum FillMode {
    /** Carry the previous slot's value forward. */
    PREVIOUS,
    NULL,
    /** Write a fixed value. */
    VALUE
}
