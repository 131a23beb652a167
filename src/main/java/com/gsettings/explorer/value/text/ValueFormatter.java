package com.gsettings.explorer.value.text;

import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.GValueVisitor;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.TupleValue;
import com.gsettings.explorer.value.VariantValue;

import java.util.stream.Collectors;

/**
 * Prints values in text notation that {@link ValueTextParser} reads back.
 *
 * Variant contents carry a type annotation unless their type would be inferred anyway
 * (boolean, int32, double, string).
 */
public final class ValueFormatter implements GValueVisitor<String> {

    private static final ValueFormatter INSTANCE = new ValueFormatter();

    private ValueFormatter() {
    }

    public static String format(GValue value) {
        return value.accept(INSTANCE);
    }

    /**
     * Quote a string the way string literals are printed.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder("'");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    @Override
    public String visit(ScalarValue scalar) {
        TypeKind kind = scalar.getKind();
        return switch (kind) {
            case BOOLEAN -> scalar.asBoolean() ? "true" : "false";
            case UINT64 -> Long.toUnsignedString(scalar.asLong());
            case BYTE, INT16, UINT16, INT32, UINT32, INT64 -> Long.toString(scalar.asLong());
            case DOUBLE -> formatDouble(scalar.asDouble());
            case STRING -> quote(scalar.asString());
            case OBJECT_PATH -> "objectpath " + quote(scalar.asString());
            case SIGNATURE -> "signature " + quote(scalar.asString());
            default -> throw new IllegalStateException("Not a scalar kind: " + kind);
        };
    }

    @Override
    public String visit(ArrayValue array) {
        return array.getElements().stream()
                .map(ValueFormatter::format)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visit(DictValue dict) {
        return dict.getEntries().stream()
                .map(e -> format(e.getKey()) + ": " + format(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visit(TupleValue tuple) {
        if (tuple.size() == 1) {
            return "(" + format(tuple.get(0)) + ",)";
        }
        return tuple.getComponents().stream()
                .map(ValueFormatter::format)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visit(MaybeValue maybe) {
        if (!maybe.isPresent()) {
            return "nothing";
        }
        String inner = format(maybe.getValue());
        return maybe.getInnerSignature().is(TypeKind.MAYBE) ? "just " + inner : inner;
    }

    @Override
    public String visit(VariantValue variant) {
        GValue inner = variant.getValue();
        return "<" + annotation(inner) + format(inner) + ">";
    }

    private static String annotation(GValue value) {
        TypeKind kind = value.getSignature().getKind();
        return switch (kind) {
            case BOOLEAN, INT32, DOUBLE, STRING, OBJECT_PATH, SIGNATURE, VARIANT -> "";
            case BYTE -> "byte ";
            case INT16 -> "int16 ";
            case UINT16 -> "uint16 ";
            case UINT32 -> "uint32 ";
            case INT64 -> "int64 ";
            case UINT64 -> "uint64 ";
            default -> "@" + value.getSignature().getSignature() + " ";
        };
    }

    private static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return Double.toString(value);
    }
}
