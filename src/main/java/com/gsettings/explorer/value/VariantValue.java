package com.gsettings.explorer.value;

import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Self-describing box. Its static type is always {@code v}; the actual type is that of {@link #getValue()}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class VariantValue extends GValue {

    private final GValue value;

    public VariantValue(@NonNull GValue value) {
        this.value = value;
    }

    public static VariantValue of(GValue value) {
        return new VariantValue(value);
    }

    /**
     * The signature of the wrapped value, discovered from the value itself.
     */
    public TypeSignature getInnerSignature() {
        return value.getSignature();
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.VARIANT;
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
