package com.gsettings.explorer.signature;

import java.util.Optional;

/**
 * Closed set of value kinds a type signature can describe.
 */
public enum TypeKind {

    BOOLEAN('b', "boolean", true),
    BYTE('y', "byte", true),
    INT16('n', "int16", true),
    UINT16('q', "uint16", true),
    INT32('i', "int32", true),
    UINT32('u', "uint32", true),
    INT64('x', "int64", true),
    UINT64('t', "uint64", true),
    DOUBLE('d', "double", true),
    STRING('s', "string", true),
    OBJECT_PATH('o', "object path", true),
    SIGNATURE('g', "signature", true),

    /**
     * Self-describing container; the inner type travels with the value.
     */
    VARIANT('v', "variant", false),
    MAYBE('m', "maybe", false),
    ARRAY('a', "array", false),

    /**
     * Array of dictionary entries ({@code a{kv}}).
     */
    DICT_ENTRY_ARRAY('a', "dictionary", false),
    TUPLE('(', "tuple", false);

    private final char code;
    private final String displayName;
    private final boolean leaf;

    TypeKind(char code, String displayName, boolean leaf) {
        this.code = code;
        this.displayName = displayName;
        this.leaf = leaf;
    }

    public char getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public boolean isInteger() {
        return switch (this) {
            case BYTE, INT16, UINT16, INT32, UINT32, INT64, UINT64 -> true;
            default -> false;
        };
    }

    public boolean isStringLike() {
        return this == STRING || this == OBJECT_PATH || this == SIGNATURE;
    }

    public boolean isUnsigned() {
        return this == BYTE || this == UINT16 || this == UINT32 || this == UINT64;
    }

    /**
     * Smallest value of an integer kind. UINT64 is handled as an unsigned bit pattern.
     */
    public long minValue() {
        return switch (this) {
            case BYTE, UINT16, UINT32, UINT64 -> 0L;
            case INT16 -> Short.MIN_VALUE;
            case INT32 -> Integer.MIN_VALUE;
            case INT64 -> Long.MIN_VALUE;
            default -> throw new IllegalStateException(displayName + " is not an integer kind");
        };
    }

    /**
     * Largest value of an integer kind. UINT64 reports -1, its all-ones bit pattern.
     */
    public long maxValue() {
        return switch (this) {
            case BYTE -> 0xFFL;
            case INT16 -> Short.MAX_VALUE;
            case UINT16 -> 0xFFFFL;
            case INT32 -> Integer.MAX_VALUE;
            case UINT32 -> 0xFFFF_FFFFL;
            case INT64 -> Long.MAX_VALUE;
            case UINT64 -> -1L;
            default -> throw new IllegalStateException(displayName + " is not an integer kind");
        };
    }

    /**
     * Leaf kind for a single signature character.
     */
    public static Optional<TypeKind> leafFromCode(char code) {
        for (TypeKind kind : values()) {
            if (kind.leaf && kind.code == code) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
