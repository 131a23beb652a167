package com.gsettings.explorer.value;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.signature.TypeSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Array of dictionary entries. Entries are kept as encoded, so duplicate keys can be represented;
 * decomposition treats the last occurrence as authoritative.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class DictValue extends GValue {

    private final TypeSignature keySignature;
    private final TypeSignature valueSignature;
    private final List<Entry> entries;

    public DictValue(TypeSignature keySignature, TypeSignature valueSignature, List<Entry> entries) {
        if (!keySignature.isLeaf()) {
            throw new TypeMismatchException("Dictionary key must be a basic type, got '" + keySignature + "'");
        }
        this.keySignature = keySignature;
        this.valueSignature = valueSignature;
        this.entries = List.copyOf(entries);
        for (Entry entry : this.entries) {
            if (!entry.getKey().getSignature().equals(keySignature)) {
                throw new TypeMismatchException("Dictionary key " + entry.getKey() + " has type '"
                        + entry.getKey().getSignature() + "', expected '" + keySignature + "'");
            }
            if (!entry.getValue().getSignature().equals(valueSignature)) {
                throw new TypeMismatchException("Dictionary value for " + entry.getKey() + " has type '"
                        + entry.getValue().getSignature() + "', expected '" + valueSignature + "'");
            }
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * Entries with duplicate keys collapsed: each key keeps the position of its first
     * occurrence and the value of its last.
     */
    public List<Entry> effectiveEntries() {
        Map<ScalarValue, Integer> positions = new HashMap<>();
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            Integer existing = positions.get(entry.getKey());
            if (existing == null) {
                positions.put(entry.getKey(), result.size());
                result.add(entry);
            } else {
                result.set(existing, entry);
            }
        }
        return result;
    }

    @Override
    public TypeSignature getSignature() {
        return TypeSignature.dictOf(keySignature, valueSignature);
    }

    @Override
    public <R> R accept(GValueVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Value
    public static class Entry {
        ScalarValue key;
        GValue value;
    }
}
