package com.gsettings.explorer.exception;

/**
 * A type signature string could not be parsed.
 */
public class MalformedSignatureException extends ValueTreeException {

    private static final long serialVersionUID = 1L;
    private final String signature;
    private final int offset;

    public MalformedSignatureException(String signature, int offset, String reason) {
        super("Malformed type signature '" + signature + "' at offset " + offset + ": " + reason);
        this.signature = signature;
        this.offset = offset;
    }

    public String getSignature() {
        return signature;
    }

    public int getOffset() {
        return offset;
    }
}
