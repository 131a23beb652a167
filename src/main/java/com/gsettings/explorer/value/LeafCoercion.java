package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.exception.ValueCoercionException;
import com.gsettings.explorer.signature.TypeKind;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Conversion between leaf values and the text shown in (and typed into) an editor.
 *
 * Booleans are spelled exactly "True" and "False"; no other spelling is accepted.
 */
@UtilityClass
public class LeafCoercion {

    public static final String TRUE_TEXT = "True";
    public static final String FALSE_TEXT = "False";

    private static final Pattern DECIMAL_FLOAT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern DECIMAL_INTEGER = Pattern.compile("[+-]?\\d+");

    /**
     * Convert editor text to a leaf value of the given kind.
     *
     * @throws ValueCoercionException when the text is not a valid value of that kind
     */
    public static ScalarValue coerce(TypeKind kind, String text) {
        if (text == null) {
            throw new ValueCoercionException(kind, "null", "no value given");
        }
        if (!kind.isLeaf()) {
            throw new ValueCoercionException(kind, text, "not a primitive type");
        }
        if (kind == TypeKind.BOOLEAN) {
            return coerceBoolean(text);
        }
        if (kind.isInteger()) {
            return coerceInteger(kind, text.strip());
        }
        if (kind == TypeKind.DOUBLE) {
            return ScalarValue.ofDouble(coerceDouble(text.strip()));
        }
        try {
            return ScalarValue.ofText(kind, text);
        } catch (TypeMismatchException e) {
            throw new ValueCoercionException(kind, text, e.getMessage(), e);
        }
    }

    /**
     * Text for a leaf value, in the spelling {@link #coerce} reads back.
     */
    public static String displayText(ScalarValue value) {
        return switch (value.getKind()) {
            case BOOLEAN -> value.asBoolean() ? TRUE_TEXT : FALSE_TEXT;
            case UINT64 -> Long.toUnsignedString(value.asLong());
            case BYTE, INT16, UINT16, INT32, UINT32, INT64 -> Long.toString(value.asLong());
            case DOUBLE -> displayDouble(value.asDouble());
            default -> value.asString();
        };
    }

    private static ScalarValue coerceBoolean(String text) {
        if (TRUE_TEXT.equals(text)) {
            return ScalarValue.ofBoolean(true);
        }
        if (FALSE_TEXT.equals(text)) {
            return ScalarValue.ofBoolean(false);
        }
        throw new ValueCoercionException(TypeKind.BOOLEAN, text, "expected " + TRUE_TEXT + " or " + FALSE_TEXT);
    }

    private static ScalarValue coerceInteger(TypeKind kind, String text) {
        if (!DECIMAL_INTEGER.matcher(text).matches()) {
            throw new ValueCoercionException(kind, text, "not an integer");
        }
        long parsed;
        try {
            if (kind == TypeKind.UINT64) {
                if (text.startsWith("-")) {
                    throw new ValueCoercionException(kind, text, "must not be negative");
                }
                parsed = Long.parseUnsignedLong(text.startsWith("+") ? text.substring(1) : text);
            } else {
                parsed = Long.parseLong(text);
            }
        } catch (NumberFormatException e) {
            throw new ValueCoercionException(kind, text, "out of range", e);
        }
        try {
            return ScalarValue.ofInteger(kind, parsed);
        } catch (TypeMismatchException e) {
            throw new ValueCoercionException(kind, text, "out of range", e);
        }
    }

    private static double coerceDouble(String text) {
        switch (text.toLowerCase()) {
            case "inf", "+inf", "infinity", "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf", "-infinity":
                return Double.NEGATIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                break;
        }
        if (!DECIMAL_FLOAT.matcher(text).matches()) {
            throw new ValueCoercionException(TypeKind.DOUBLE, text, "not a number");
        }
        return Double.parseDouble(text);
    }

    private static String displayDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return Double.toString(value);
    }
}
