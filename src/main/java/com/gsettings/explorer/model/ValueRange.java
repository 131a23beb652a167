package com.gsettings.explorer.model;

import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.LeafCoercion;
import com.gsettings.explorer.value.ScalarValue;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Declared restriction on a key's values: none, a min/max pair, or a list of allowed choices.
 */
@Value
public class ValueRange {

    private static final ValueRange NONE = new ValueRange(RangeKind.TYPE, List.of());

    RangeKind kind;

    /**
     * [min, max] for {@link RangeKind#RANGE}, the choices for ENUM and FLAGS, empty otherwise.
     */
    List<ScalarValue> values;

    public static ValueRange none() {
        return NONE;
    }

    public static ValueRange between(ScalarValue min, ScalarValue max) {
        if (!isComparable(min) || !isComparable(max)) {
            throw new IllegalArgumentException("Range bounds must be finite numbers, got " + min + " and " + max);
        }
        if (min.asDecimal().compareTo(max.asDecimal()) > 0) {
            throw new IllegalArgumentException("Range minimum " + min + " is above maximum " + max);
        }
        return new ValueRange(RangeKind.RANGE, List.of(min, max));
    }

    public static ValueRange choices(List<String> choices) {
        return new ValueRange(RangeKind.ENUM, choices.stream().map(ScalarValue::ofString).toList());
    }

    public static ValueRange flags(List<String> choices) {
        return new ValueRange(RangeKind.FLAGS, choices.stream().map(ScalarValue::ofString).toList());
    }

    public boolean isRestricted() {
        return kind != RangeKind.TYPE && !values.isEmpty();
    }

    public List<String> choiceTexts() {
        return values.stream().map(LeafCoercion::displayText).toList();
    }

    /**
     * Whether a value satisfies this restriction. Values of an unexpected shape are not admitted.
     */
    public boolean admits(GValue value) {
        return switch (kind) {
            case TYPE -> true;
            case RANGE -> value instanceof ScalarValue scalar && isComparable(scalar)
                    && scalar.asDecimal().compareTo(values.get(0).asDecimal()) >= 0
                    && scalar.asDecimal().compareTo(values.get(1).asDecimal()) <= 0;
            case ENUM -> value instanceof ScalarValue scalar && scalar.getKind().isStringLike()
                    && choiceTexts().contains(scalar.asString());
            case FLAGS -> value instanceof ArrayValue array && array.getElements().stream()
                    .allMatch(e -> e instanceof ScalarValue s && s.getKind().isStringLike()
                            && choiceTexts().contains(s.asString()));
        };
    }

    /**
     * Integers and finite doubles. Infinities and NaN fall outside every range.
     */
    private static boolean isComparable(ScalarValue scalar) {
        if (scalar.getKind() == TypeKind.DOUBLE) {
            return Double.isFinite(scalar.asDouble());
        }
        return scalar.getKind().isInteger();
    }

    /**
     * Human-readable form, e.g. {@code range : [0, 100]} or {@code enum : ['a', 'b']}.
     */
    public String describe() {
        return kind.getLabel() + " : " + values.stream()
                .map(GValue::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
