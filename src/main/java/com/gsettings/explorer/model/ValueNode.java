package com.gsettings.explorer.model;

import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.LeafCoercion;
import com.gsettings.explorer.value.ScalarValue;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One node of an editable value tree.
 *
 * A leaf holds a primitive value, a compound node holds its children in encoding order.
 * Nodes own their children exclusively and keep no reference to their parent.
 */
@Getter
@ToString
public class ValueNode {

    /**
     * Name of the single child of a present maybe, and of the child under a root variant wrapper.
     */
    public static final String INNER_NAME = "value";

    private final String name;

    /**
     * Actual type of this node's value. For a node unwrapped from a variant this is the
     * discovered type, not {@code v}.
     */
    private final TypeSignature signature;

    /**
     * Type the enclosing container declares for this slot.
     */
    private TypeSignature declaredSignature;

    /**
     * Number of variant wrappers that were flattened away above this node.
     */
    private int variantDepth;

    /**
     * True only for a root node of type {@code v}, which is kept as a wrapper rather than flattened.
     */
    private final boolean variantWrapper;

    private final ScalarValue leafValue;

    /**
     * Pending edit; coerced to the leaf type when the tree is recomposed.
     */
    private String editedText;

    @ToString.Exclude
    private final List<ValueNode> children;

    private ValueNode(String name, TypeSignature signature, boolean variantWrapper, ScalarValue leafValue) {
        this.name = name;
        this.signature = signature;
        this.declaredSignature = signature;
        this.variantWrapper = variantWrapper;
        this.leafValue = leafValue;
        this.children = leafValue == null ? new ArrayList<>() : Collections.emptyList();
    }

    public static ValueNode leaf(String name, ScalarValue value) {
        return new ValueNode(name, value.getSignature(), false, value);
    }

    public static ValueNode compound(String name, TypeSignature signature) {
        if (signature.isLeaf()) {
            throw new IllegalArgumentException("Compound node needs a container type, got " + signature);
        }
        return new ValueNode(name, signature, false, null);
    }

    public static ValueNode variantWrapper(String name) {
        return new ValueNode(name, TypeSignature.VARIANT, true, null);
    }

    public boolean isCompound() {
        return leafValue == null;
    }

    public boolean isLeaf() {
        return leafValue != null;
    }

    public boolean isVariantWrapped() {
        return variantDepth > 0;
    }

    /**
     * Record that this node stands in for {@code depth} nested variants declared as {@code declared}.
     */
    public void markVariantWrapped(TypeSignature declared, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("Variant depth must be positive: " + depth);
        }
        this.declaredSignature = declared;
        this.variantDepth = depth;
    }

    public List<ValueNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public void addChild(ValueNode child) {
        requireCompound();
        children.add(child);
    }

    public void replaceChild(int index, ValueNode child) {
        requireCompound();
        children.set(index, child);
    }

    public Optional<ValueNode> findChild(String childName) {
        return children.stream().filter(c -> c.getName().equals(childName)).findFirst();
    }

    public int indexOf(String childName) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getName().equals(childName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Replace the leaf's value with editor text. The text is validated when the tree is recomposed.
     */
    public void edit(String text) {
        if (!isLeaf()) {
            throw new IllegalStateException("Node '" + name + "' of type " + signature + " is not a leaf");
        }
        this.editedText = text;
    }

    public void discardEdit() {
        this.editedText = null;
    }

    public boolean isEdited() {
        return editedText != null;
    }

    public TypeKind getKind() {
        return signature.getKind();
    }

    /**
     * Text shown for a leaf: the pending edit if there is one, otherwise the stored value.
     */
    public String getDisplayValue() {
        if (!isLeaf()) {
            return null;
        }
        return editedText != null ? editedText : LeafCoercion.displayText(leafValue);
    }

    private void requireCompound() {
        if (!isCompound()) {
            throw new IllegalStateException("Node '" + name + "' is a leaf and cannot have children");
        }
    }
}
