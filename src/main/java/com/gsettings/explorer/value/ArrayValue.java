package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * Homogeneous array. Element order is significant.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class ArrayValue extends GValue {

    private final TypeSignature elementSignature;
    private final List<GValue> elements;

    public ArrayValue(TypeSignature elementSignature, List<? extends GValue> elements) {
        this.elementSignature = elementSignature;
        this.elements = List.copyOf(elements);
        for (int i = 0; i < this.elements.size(); i++) {
            TypeSignature actual = this.elements.get(i).getSignature();
            if (!actual.equals(elementSignature)) {
                throw new TypeMismatchException("Array element " + i + " has type '" + actual
                        + "', expected '" + elementSignature + "'");
            }
        }
    }

    public int size() {
        return elements.size();
    }

    public GValue get(int index) {
        return elements.get(index);
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.arrayOf(elementSignature);
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
