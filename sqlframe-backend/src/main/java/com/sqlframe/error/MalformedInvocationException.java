package com.sqlframe.error;

/**
 * Thrown when a macro invocation's argument list is not closed.
 */
public class MalformedInvocationException extends FrameQueryException {
    private final String macroName;
    private final int position;

    public MalformedInvocationException(String macroName, int position) {
        super("MALFORMED_MACRO", "Unbalanced parentheses in $__" + macroName + " at position " + position);
        this.macroName = macroName;
        this.position = position;
    }

    public String getMacroName() {
        return macroName;
    }

    public int getPosition() {
        return position;
    }
}
