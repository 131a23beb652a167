package com.gsettings.explorer.tree;

import com.gsettings.explorer.exception.StructuralMismatchException;
import com.gsettings.explorer.exception.ValueCoercionException;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.model.ValueNode;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.LeafCoercion;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.TupleValue;
import com.gsettings.explorer.value.VariantValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds an encoded value from a (possibly edited) {@link ValueNode} tree.
 *
 * This is the inverse of {@link Decomposer}: variants that were flattened during decomposition
 * are wrapped again at the same position, so an unedited tree reproduces the original value.
 */
public class Recomposer {
    private static final Logger log = LoggerFactory.getLogger(Recomposer.class);

    public GValue recompose(KeyTree tree) {
        return recompose(tree.getRoot(), tree.getSignature());
    }

    /**
     * @throws ValueCoercionException      when an edited leaf does not parse as its type
     * @throws StructuralMismatchException when the tree does not have the shape of {@code signature}
     */
    public GValue recompose(ValueNode root, TypeSignature signature) {
        GValue result;
        if (root.isVariantWrapper()) {
            if (!signature.is(TypeKind.VARIANT) || root.childCount() != 1) {
                throw new StructuralMismatchException("Variant wrapper '" + root.getName()
                        + "' must have exactly one child and type 'v', has " + root.childCount()
                        + " child(ren) and type '" + signature + "'");
            }
            result = recomposeElement(root.getChildren().get(0), signature);
        } else {
            result = recomposeElement(root, signature);
        }
        log.debug("Recomposed '{}' as {}", root.getName(), signature);
        return result;
    }

    /**
     * Value of a single node on its own, without any variant wrapping it carries in its parent.
     * A root variant wrapper yields its child's value.
     */
    public GValue recomposeNode(ValueNode node) {
        if (node.isVariantWrapper()) {
            if (node.childCount() != 1) {
                throw new StructuralMismatchException("Variant wrapper '" + node.getName()
                        + "' must have exactly one child, has " + node.childCount());
            }
            return recomposeNode(node.getChildren().get(0));
        }
        return recomposeValue(node, node.getSignature());
    }

    private GValue recomposeElement(ValueNode node, TypeSignature declared) {
        if (!declared.is(TypeKind.VARIANT)) {
            if (node.isVariantWrapped()) {
                throw new StructuralMismatchException("Node '" + node.getName() + "' was unwrapped from a variant"
                        + " but its slot has type '" + declared + "'");
            }
            return recomposeValue(node, declared);
        }
        if (!node.isVariantWrapped()) {
            throw new StructuralMismatchException("Node '" + node.getName() + "' fills a variant slot"
                    + " but carries no variant wrapping");
        }
        GValue value = recomposeValue(node, node.getSignature());
        for (int i = 0; i < node.getVariantDepth(); i++) {
            value = VariantValue.of(value);
        }
        return value;
    }

    private GValue recomposeValue(ValueNode node, TypeSignature signature) {
        if (!node.getSignature().equals(signature)) {
            throw new StructuralMismatchException("Node '" + node.getName() + "' has type '" + node.getSignature()
                    + "', expected '" + signature + "'");
        }
        return switch (signature.getKind()) {
            case ARRAY -> recomposeArray(node, signature);
            case DICT_ENTRY_ARRAY -> recomposeDict(node, signature);
            case TUPLE -> recomposeTuple(node, signature);
            case MAYBE -> recomposeMaybe(node, signature);
            case VARIANT -> throw new StructuralMismatchException("Unexpected variant wrapper '" + node.getName()
                    + "' below the root");
            default -> recomposeLeaf(node);
        };
    }

    private ScalarValue recomposeLeaf(ValueNode node) {
        if (!node.isLeaf()) {
            throw new StructuralMismatchException("Node '" + node.getName() + "' should be a leaf");
        }
        if (node.isEdited()) {
            return LeafCoercion.coerce(node.getKind(), node.getEditedText());
        }
        return node.getLeafValue();
    }

    private GValue recomposeArray(ValueNode node, TypeSignature signature) {
        TypeSignature element = signature.elementSignature();
        List<GValue> elements = new ArrayList<>();
        for (ValueNode child : node.getChildren()) {
            elements.add(recomposeElement(child, element));
        }
        return new ArrayValue(element, elements);
    }

    private GValue recomposeDict(ValueNode node, TypeSignature signature) {
        TypeSignature keySignature = signature.keySignature();
        Set<ScalarValue> seen = new HashSet<>();
        List<DictValue.Entry> entries = new ArrayList<>();
        for (ValueNode child : node.getChildren()) {
            ScalarValue key = LeafCoercion.coerce(keySignature.getKind(), child.getName());
            if (!seen.add(key)) {
                throw new StructuralMismatchException("Duplicate dictionary key '" + child.getName()
                        + "' in '" + node.getName() + "'");
            }
            entries.add(new DictValue.Entry(key, recomposeElement(child, signature.valueSignature())));
        }
        return new DictValue(keySignature, signature.valueSignature(), entries);
    }

    private GValue recomposeTuple(ValueNode node, TypeSignature signature) {
        List<TypeSignature> components = signature.componentSignatures();
        if (node.childCount() != components.size()) {
            throw new StructuralMismatchException("Tuple '" + node.getName() + "' has " + node.childCount()
                    + " component(s), type '" + signature + "' needs " + components.size());
        }
        List<GValue> values = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            values.add(recomposeElement(node.getChildren().get(i), components.get(i)));
        }
        return new TupleValue(values);
    }

    private GValue recomposeMaybe(ValueNode node, TypeSignature signature) {
        TypeSignature inner = signature.innerSignature();
        return switch (node.childCount()) {
            case 0 -> MaybeValue.nothing(inner);
            case 1 -> MaybeValue.just(inner, recomposeElement(node.getChildren().get(0), inner));
            default -> throw new StructuralMismatchException("Maybe '" + node.getName() + "' has "
                    + node.childCount() + " children, at most one allowed");
        };
    }
}
