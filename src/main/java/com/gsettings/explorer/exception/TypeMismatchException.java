package com.gsettings.explorer.exception;

/**
 * An encoded value does not have the type its signature declares.
 */
public class TypeMismatchException extends ValueTreeException {

    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message) {
        super(message);
    }
}
