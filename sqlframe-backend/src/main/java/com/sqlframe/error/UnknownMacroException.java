package com.sqlframe.error;

/**
 * Thrown when a {@code $__name} invocation has no registered macro.
 */
public class UnknownMacroException extends FrameQueryException {
    private final String macroName;

    public UnknownMacroException(String macroName) {
        super("UNKNOWN_MACRO", "Unknown macro: $__" + macroName);
        this.macroName = macroName;
    }

    public String getMacroName() {
        return macroName;
    }
}
