package com.gsettings.explorer.exception;

/**
 * Value text could not be parsed.
 */
public class ValueSyntaxException extends ValueTreeException {

    private static final long serialVersionUID = 1L;
    private final int offset;

    public ValueSyntaxException(String text, int offset, String reason) {
        super("Invalid value text at offset " + offset + ": " + reason + " in '" + text + "'");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
