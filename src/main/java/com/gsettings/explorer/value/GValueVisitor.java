package com.gsettings.explorer.value;

/**
 * Visitor over the encoded value hierarchy.
 */
public interface GValueVisitor<R> {
    R visit(ScalarValue scalar);
    R visit(ArrayValue array);
    R visit(DictValue dict);
    R visit(TupleValue tuple);
    R visit(MaybeValue maybe);
    R visit(VariantValue variant);
}
