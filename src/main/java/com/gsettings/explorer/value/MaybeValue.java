package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Nullable wrapper: either "nothing" or "just" an inner value.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class MaybeValue extends GValue {

    private final TypeSignature innerSignature;
    private final GValue value;

    private MaybeValue(TypeSignature innerSignature, GValue value) {
        this.innerSignature = innerSignature;
        this.value = value;
    }

    public static MaybeValue nothing(TypeSignature innerSignature) {
        return new MaybeValue(innerSignature, null);
    }

    public static MaybeValue just(TypeSignature innerSignature, GValue value) {
        if (value == null) {
            throw new TypeMismatchException("Use nothing() for an absent maybe value");
        }
        if (!value.getSignature().equals(innerSignature)) {
            throw new TypeMismatchException("Maybe value has type '" + value.getSignature()
                    + "', expected '" + innerSignature + "'");
        }
        return new MaybeValue(innerSignature, value);
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.maybeOf(innerSignature);
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
