package com.gsettings.explorer.signature;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed type signature: its kind plus the signatures it is built from.
 *
 * Instances are immutable and compare equal when their canonical strings match.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class TypeSignature {

    public static final TypeSignature VARIANT = new TypeSignature("v", TypeKind.VARIANT, List.of());
    public static final TypeSignature UNIT = new TypeSignature("()", TypeKind.TUPLE, List.of());

    @EqualsAndHashCode.Include
    private final String signature;
    private final TypeKind kind;

    /**
     * Array element, maybe inner type, dictionary key and value, or tuple components.
     */
    private final List<TypeSignature> children;

    private TypeSignature(String signature, TypeKind kind, List<TypeSignature> children) {
        this.signature = signature;
        this.kind = kind;
        this.children = List.copyOf(children);
    }

    public static TypeSignature parse(String signature) {
        return SignatureParser.parse(signature);
    }

    public static TypeSignature leaf(TypeKind kind) {
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is not a leaf kind");
        }
        return new TypeSignature(String.valueOf(kind.getCode()), kind, List.of());
    }

    public static TypeSignature arrayOf(TypeSignature element) {
        return new TypeSignature("a" + element.signature, TypeKind.ARRAY, List.of(element));
    }

    public static TypeSignature maybeOf(TypeSignature inner) {
        return new TypeSignature("m" + inner.signature, TypeKind.MAYBE, List.of(inner));
    }

    public static TypeSignature dictOf(TypeSignature key, TypeSignature value) {
        if (!key.isLeaf()) {
            throw new IllegalArgumentException("Dictionary key must be a basic type, got " + key);
        }
        return new TypeSignature("a{" + key.signature + value.signature + "}",
                TypeKind.DICT_ENTRY_ARRAY, List.of(key, value));
    }

    public static TypeSignature tupleOf(List<TypeSignature> components) {
        String body = components.stream().map(TypeSignature::getSignature).collect(Collectors.joining());
        return new TypeSignature("(" + body + ")", TypeKind.TUPLE, components);
    }

    public boolean isLeaf() {
        return kind.isLeaf();
    }

    public boolean is(TypeKind other) {
        return kind == other;
    }

    public TypeSignature elementSignature() {
        require(TypeKind.ARRAY);
        return children.get(0);
    }

    public TypeSignature innerSignature() {
        require(TypeKind.MAYBE);
        return children.get(0);
    }

    public TypeSignature keySignature() {
        require(TypeKind.DICT_ENTRY_ARRAY);
        return children.get(0);
    }

    public TypeSignature valueSignature() {
        require(TypeKind.DICT_ENTRY_ARRAY);
        return children.get(1);
    }

    public List<TypeSignature> componentSignatures() {
        require(TypeKind.TUPLE);
        return children;
    }

    private void require(TypeKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Signature '" + signature + "' is " + kind.getDisplayName()
                    + ", not " + expected.getDisplayName());
        }
    }

    @Override
    public String toString() {
        return signature;
    }
}
