package com.gsettings.explorer.model;

/**
 * Kinds of value restriction a settings key can declare.
 */
public enum RangeKind {
    /**
     * Any value of the key's type.
     */
    TYPE("type"),
    /**
     * Numeric value between a minimum and a maximum, inclusive.
     */
    RANGE("range"),
    /**
     * One string out of a list of choices.
     */
    ENUM("enum"),
    /**
     * Array of strings, each one out of a list of choices.
     */
    FLAGS("flags");

    private final String label;

    RangeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RangeKind fromLabel(String label) {
        for (RangeKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown range kind: " + label);
    }
}
