package com.gsettings.explorer.store;

import com.gsettings.explorer.exception.TypeMismatchException;
import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.model.ValueNode;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.tree.Decomposer;
import com.gsettings.explorer.tree.Recomposer;
import com.gsettings.explorer.value.ArrayValue;
import com.gsettings.explorer.value.DictValue;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.MaybeValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.TupleValue;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Edits one settings key, one leaf at a time.
 *
 * The tree is decomposed from the store's current value when the session opens. Each commit
 * edits a single leaf, recomposes the whole value and writes it. A failed commit leaves both
 * the store and the tree as they were.
 */
public class EditSession {
    private static final Logger log = LoggerFactory.getLogger(EditSession.class);

    private final SettingsStore store;
    private final String path;
    private final Decomposer decomposer = new Decomposer();
    private final Recomposer recomposer = new Recomposer();

    @Getter
    private KeyTree tree;

    private EditSession(SettingsStore store, String path, KeyTree tree) {
        this.store = store;
        this.path = path;
        this.tree = tree;
    }

    /**
     * Open a key for editing. A key without a stored value starts from the empty value of its type.
     *
     * @throws IllegalArgumentException when the schema source does not know the key
     */
    public static EditSession open(SchemaSource schemas, SettingsStore store,
                                   String schemaId, String keyName, String path) {
        KeyMetadata key = schemas.lookupKey(schemaId, keyName)
                .orElseThrow(() -> new IllegalArgumentException("No key '" + keyName + "' in schema '" + schemaId + "'"));
        GValue current = store.read(schemaId, keyName, path)
                .orElseGet(() -> emptyValue(key.getSignature()));
        EditSession session = new EditSession(store, path, new Decomposer().decomposeKey(key, current));
        log.debug("Opened edit session for {}{}", key, path != null ? " at " + path : "");
        return session;
    }

    /**
     * Set one leaf to {@code text}, then recompose and store the key's value.
     */
    public EditResult commit(List<String> leafPath, String text) {
        ValueNode node = tree.find(leafPath).orElse(null);
        if (node == null) {
            return EditResult.failure("No node at '" + String.join("/", leafPath) + "' in " + tree.getMetadata());
        }
        if (!node.isLeaf()) {
            return EditResult.failure("'" + tree.fullPath(leafPath) + "' is a " + node.getSignature()
                    + " value, only single values can be edited");
        }
        String previous = node.getEditedText();
        node.edit(text);
        KeyMetadata key = tree.getMetadata();
        try {
            GValue value = recomposer.recompose(tree);
            store.write(key.getSchemaId(), key.getKeyName(), path, value);
            log.info("Committed {} = {}", tree.fullPath(leafPath), value);
            tree = decomposer.decomposeKey(key, value);
            return EditResult.success(value);
        } catch (ValueTreeException e) {
            restore(node, previous);
            log.debug("Commit of {} rejected: {}", tree.fullPath(leafPath), e.getMessage());
            return EditResult.failure(e);
        }
    }

    private static void restore(ValueNode node, String previous) {
        if (previous == null) {
            node.discardEdit();
        } else {
            node.edit(previous);
        }
    }

    /**
     * Starting value for a key that has none: zero for basic types, empty containers otherwise.
     */
    static GValue emptyValue(TypeSignature signature) {
        return switch (signature.getKind()) {
            case ARRAY -> new ArrayValue(signature.elementSignature(), List.of());
            case DICT_ENTRY_ARRAY -> new DictValue(signature.keySignature(), signature.valueSignature(), List.of());
            case MAYBE -> MaybeValue.nothing(signature.innerSignature());
            case TUPLE -> new TupleValue(signature.componentSignatures().stream().map(EditSession::emptyValue).toList());
            case VARIANT -> throw new TypeMismatchException("A variant has no empty value; its type is unknown");
            default -> ScalarValue.zero(signature.getKind());
        };
    }
}
