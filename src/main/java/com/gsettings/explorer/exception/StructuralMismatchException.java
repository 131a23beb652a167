package com.gsettings.explorer.exception;

/**
 * A value tree does not have the shape its signature requires.
 */
public class StructuralMismatchException extends ValueTreeException {

    private static final long serialVersionUID = 1L;

    public StructuralMismatchException(String message) {
        super(message);
    }
}
