package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.MalformedSignatureException;
import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.signature.SignatureParser;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * A single primitive value.
 *
 * Integers of every width are held as {@link Long}; uint64 keeps its unsigned bit pattern.
 * Doubles are held as {@link Double}, strings, object paths and signatures as {@link String}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ScalarValue extends GValue {

    private static final Pattern OBJECT_PATH = Pattern.compile("/|(/[A-Za-z0-9_]+)+");

    private final TypeKind kind;
    private final Object value;

    private ScalarValue(TypeKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ScalarValue ofBoolean(boolean value) {
        return new ScalarValue(TypeKind.BOOLEAN, value);
    }

    public static ScalarValue ofInt32(int value) {
        return new ScalarValue(TypeKind.INT32, (long) value);
    }

    public static ScalarValue ofInt64(long value) {
        return new ScalarValue(TypeKind.INT64, value);
    }

    public static ScalarValue ofDouble(double value) {
        return new ScalarValue(TypeKind.DOUBLE, value);
    }

    public static ScalarValue ofString(String value) {
        return ofText(TypeKind.STRING, value);
    }

    /**
     * Integer value of the given width, range checked. For uint64 pass the unsigned bit pattern.
     */
    public static ScalarValue ofInteger(TypeKind kind, long value) {
        if (!kind.isInteger()) {
            throw new TypeMismatchException(kind.getDisplayName() + " is not an integer type");
        }
        if (kind != TypeKind.UINT64 && kind != TypeKind.INT64
                && (value < kind.minValue() || value > kind.maxValue())) {
            throw new TypeMismatchException(value + " is out of range for " + kind.getDisplayName()
                    + " [" + kind.minValue() + ", " + kind.maxValue() + "]");
        }
        return new ScalarValue(kind, value);
    }

    /**
     * String, object path or signature value. Object paths and signatures are validated.
     */
    public static ScalarValue ofText(TypeKind kind, String value) {
        if (!kind.isStringLike()) {
            throw new TypeMismatchException(kind.getDisplayName() + " is not a string type");
        }
        if (value == null) {
            throw new TypeMismatchException("null is not a valid " + kind.getDisplayName());
        }
        if (kind == TypeKind.OBJECT_PATH && !OBJECT_PATH.matcher(value).matches()) {
            throw new TypeMismatchException("'" + value + "' is not a valid object path");
        }
        if (kind == TypeKind.SIGNATURE) {
            try {
                SignatureParser.parseAll(value);
            } catch (MalformedSignatureException e) {
                throw new TypeMismatchException("'" + value + "' is not a valid signature: " + e.getMessage());
            }
        }
        return new ScalarValue(kind, value);
    }

    /**
     * The "empty" value of a leaf kind: false, 0, 0.0, "", "/" or "".
     */
    public static ScalarValue zero(TypeKind kind) {
        if (kind == TypeKind.BOOLEAN) {
            return ofBoolean(false);
        }
        if (kind.isInteger()) {
            return ofInteger(kind, 0L);
        }
        if (kind == TypeKind.DOUBLE) {
            return ofDouble(0.0);
        }
        if (kind == TypeKind.OBJECT_PATH) {
            return ofText(kind, "/");
        }
        if (kind.isStringLike()) {
            return ofText(kind, "");
        }
        throw new TypeMismatchException(kind.getDisplayName() + " has no scalar zero value");
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.leaf(kind);
    }

    public boolean asBoolean() {
        requireKind(kind == TypeKind.BOOLEAN, "boolean");
        return (Boolean) value;
    }

    public long asLong() {
        requireKind(kind.isInteger(), "integer");
        return (Long) value;
    }

    public double asDouble() {
        requireKind(kind == TypeKind.DOUBLE, "double");
        return (Double) value;
    }

    public String asString() {
        requireKind(kind.isStringLike(), "string");
        return (String) value;
    }

    /**
     * Numeric view used for range comparisons; uint64 is widened without sign.
     */
    public BigDecimal asDecimal() {
        if (kind == TypeKind.UINT64) {
            return new BigDecimal(Long.toUnsignedString(asLong()));
        }
        if (kind.isInteger()) {
            return BigDecimal.valueOf(asLong());
        }
        if (kind == TypeKind.DOUBLE) {
            return BigDecimal.valueOf(asDouble());
        }
        throw new TypeMismatchException(kind.getDisplayName() + " is not numeric");
    }

    private void requireKind(boolean ok, String wanted) {
        if (!ok) {
            throw new TypeMismatchException("Value of type " + kind.getDisplayName() + " is not a " + wanted);
        }
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
