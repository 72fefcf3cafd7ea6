package com.sqlframe.error;

public class EmptyFrameException extends FrameQueryException {
    public EmptyFrameException(String message) {
        super("EMPTY_FRAME", message);
    }
}
