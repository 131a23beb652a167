package com.gsettings.explorer.tree;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.model.KeyMetadata;
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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Breaks an encoded value into a tree of {@link ValueNode}s, one node per container level and element.
 *
 * Array and tuple elements are named by position, dictionary entries by their key text.
 * Variants nested inside a container are flattened: the wrapped value takes the variant's place
 * and remembers how many wrappers it lost. A variant at the root is kept as a wrapper node.
 */
public class Decomposer {
    private static final Logger log = LoggerFactory.getLogger(Decomposer.class);

    public KeyTree decomposeKey(KeyMetadata metadata, GValue value) {
        ValueNode root = decompose(metadata.getSignature(), value, metadata.getKeyName());
        log.debug("Decomposed {} ({}) into {} top-level node(s)", metadata, metadata.getType(), root.childCount());
        return new KeyTree(metadata, root);
    }

    /**
     * Decompose a root value.
     *
     * @throws TypeMismatchException when the value does not have the declared type
     */
    public ValueNode decompose(TypeSignature signature, GValue value, String name) {
        if (signature.is(TypeKind.VARIANT)) {
            ValueNode wrapper = ValueNode.variantWrapper(name);
            wrapper.addChild(decomposeElement(signature, value, ValueNode.INNER_NAME));
            return wrapper;
        }
        return decomposeElement(signature, value, name);
    }

    private ValueNode decomposeElement(TypeSignature declared, GValue value, String name) {
        if (!declared.is(TypeKind.VARIANT)) {
            return decomposeValue(declared, value, name);
        }
        if (!(value instanceof VariantValue)) {
            throw mismatch(declared, value, name);
        }
        GValue inner = value;
        int depth = 0;
        while (inner instanceof VariantValue variant) {
            inner = variant.getValue();
            depth++;
        }
        ValueNode node = decomposeValue(inner.getSignature(), inner, name);
        node.markVariantWrapped(declared, depth);
        return node;
    }

    private ValueNode decomposeValue(TypeSignature signature, GValue value, String name) {
        switch (signature.getKind()) {
            case ARRAY:
                return decomposeArray(signature, value, name);
            case DICT_ENTRY_ARRAY:
                return decomposeDict(signature, value, name);
            case TUPLE:
                return decomposeTuple(signature, value, name);
            case MAYBE:
                return decomposeMaybe(signature, value, name);
            case VARIANT:
                throw new IllegalStateException("Variant '" + name + "' should have been unwrapped");
            default:
                if (!(value instanceof ScalarValue scalar) || scalar.getKind() != signature.getKind()) {
                    throw mismatch(signature, value, name);
                }
                return ValueNode.leaf(name, scalar);
        }
    }

    private ValueNode decomposeArray(TypeSignature signature, GValue value, String name) {
        if (!(value instanceof ArrayValue array) || !array.getElementSignature().equals(signature.elementSignature())) {
            throw mismatch(signature, value, name);
        }
        ValueNode node = ValueNode.compound(name, signature);
        List<GValue> elements = array.getElements();
        for (int i = 0; i < elements.size(); i++) {
            node.addChild(decomposeElement(signature.elementSignature(), elements.get(i), String.valueOf(i)));
        }
        return node;
    }

    private ValueNode decomposeDict(TypeSignature signature, GValue value, String name) {
        if (!(value instanceof DictValue dict) || !dict.getSignature().equals(signature)) {
            throw mismatch(signature, value, name);
        }
        ValueNode node = ValueNode.compound(name, signature);
        Map<String, Integer> positions = new HashMap<>();
        for (DictValue.Entry entry : dict.getEntries()) {
            String childName = LeafCoercion.displayText(entry.getKey());
            ValueNode child = decomposeElement(signature.valueSignature(), entry.getValue(), childName);
            Integer existing = positions.get(childName);
            if (existing != null) {
                log.debug("Duplicate key '{}' in {}, keeping the later value", childName, name);
                node.replaceChild(existing, child);
            } else {
                positions.put(childName, node.childCount());
                node.addChild(child);
            }
        }
        return node;
    }

    private ValueNode decomposeTuple(TypeSignature signature, GValue value, String name) {
        List<TypeSignature> components = signature.componentSignatures();
        if (!(value instanceof TupleValue tuple) || tuple.size() != components.size()) {
            throw mismatch(signature, value, name);
        }
        ValueNode node = ValueNode.compound(name, signature);
        for (int i = 0; i < components.size(); i++) {
            node.addChild(decomposeElement(components.get(i), tuple.get(i), String.valueOf(i)));
        }
        return node;
    }

    private ValueNode decomposeMaybe(TypeSignature signature, GValue value, String name) {
        if (!(value instanceof MaybeValue maybe) || !maybe.getInnerSignature().equals(signature.innerSignature())) {
            throw mismatch(signature, value, name);
        }
        ValueNode node = ValueNode.compound(name, signature);
        if (maybe.isPresent()) {
            node.addChild(decomposeElement(signature.innerSignature(), maybe.getValue(), ValueNode.INNER_NAME));
        }
        return node;
    }

    private static TypeMismatchException mismatch(TypeSignature expected, GValue value, String name) {
        return new TypeMismatchException("Value of '" + name + "' has type '" + value.getSignature()
                + "', expected '" + expected + "'");
    }
}
