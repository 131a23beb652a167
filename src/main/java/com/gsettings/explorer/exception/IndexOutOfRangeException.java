package com.gsettings.explorer.exception;

/**
 * A positional default was requested for an element the default does not have.
 */
public class IndexOutOfRangeException extends ValueTreeException {

    private static final long serialVersionUID = 1L;
    private final int index;
    private final int size;

    public IndexOutOfRangeException(int index, int size) {
        super("Default has " + size + " element(s), no element at index " + index);
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
