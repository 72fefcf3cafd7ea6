package com.sqlframe.error;

/**
 * Thrown by a macro that rejects the number or content of its arguments.
 */
public class MacroArgumentException extends FrameQueryException {
    private final String macroName;

    public MacroArgumentException(String macroName, String message) {
        super("MACRO_ARGUMENT", "$__" + macroName + ": " + message);
        this.macroName = macroName;
    }

    public String getMacroName() {
        return macroName;
    }
}
