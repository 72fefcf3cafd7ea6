package com.sqlframe.convert;

/**
 * Converts a present native value into the Java representation of a frame field type.
 */
@FunctionalInterface
public interface ValueConverter {
    Object convert(Object value) throws Exception;
}
