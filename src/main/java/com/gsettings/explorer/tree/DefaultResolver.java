package com.gsettings.explorer.tree;

import com.gsettings.explorer.exception.IndexOutOfRangeException;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.TupleValue;
import com.gsettings.explorer.value.VariantValue;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Picks the part of a key's default value that applies to one node of its value tree.
 *
 * Elements of a compound value are matched to the default by position among their
 * siblings, never by comparing values.
 */
@UtilityClass
public class DefaultResolver {

    /**
     * @param defaultValue  the key's default
     * @param compoundWhole true when the queried node is the whole value rather than one element
     * @param siblingIndex  position of the queried element among its siblings
     * @throws IndexOutOfRangeException when the default has no element at {@code siblingIndex}
     */
    public GValue resolveDefault(@NonNull GValue defaultValue, boolean compoundWhole, int siblingIndex) {
        if (compoundWhole) {
            return defaultValue;
        }
        List<GValue> elements = positionalElements(unwrapVariants(defaultValue));
        if (elements == null) {
            return defaultValue;
        }
        if (siblingIndex < 0 || siblingIndex >= elements.size()) {
            throw new IndexOutOfRangeException(siblingIndex, elements.size());
        }
        return elements.get(siblingIndex);
    }

    public GValue unwrapVariants(GValue value) {
        GValue current = value;
        while (current instanceof VariantValue variant) {
            current = variant.getValue();
        }
        return current;
    }

    /**
     * Elements in the order decomposition lays them out, or null for a value with no elements.
     */
    private List<GValue> positionalElements(GValue value) {
        if (value instanceof ArrayValue array) {
            return array.getElements();
        }
        if (value instanceof TupleValue tuple) {
            return tuple.getComponents();
        }
        if (value instanceof DictValue dict) {
            return dict.effectiveEntries().stream().map(DictValue.Entry::getValue).toList();
        }
        if (value instanceof MaybeValue maybe) {
            return maybe.isPresent() ? List.of(maybe.getValue()) : List.of();
        }
        return null;
    }
}
