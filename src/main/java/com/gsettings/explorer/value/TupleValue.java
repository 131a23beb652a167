package com.gsettings.explorer.value;

import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * Fixed-arity heterogeneous tuple.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class TupleValue extends GValue {

    private final List<GValue> components;

    public TupleValue(List<? extends GValue> components) {
        this.components = List.copyOf(components);
    }

    public static TupleValue of(GValue... components) {
        return new TupleValue(List.of(components));
    }

    public int size() {
        return components.size();
    }

    public GValue get(int index) {
        return components.get(index);
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.tupleOf(components.stream().map(GValue::getSignature).toList());
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
