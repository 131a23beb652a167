package com.gsettings.explorer.exception;

/**
 * Base type for every failure raised while parsing signatures or converting
 * between encoded values and value trees.
 */
public abstract class ValueTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ValueTreeException(String message) {
        super(message);
    }

    protected ValueTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
