package com.gsettings.explorer.store;

import com.gsettings.explorer.exception.PersistenceRejectedException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.value.GValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings store kept in memory. Unset keys read as their schema default.
 *
 * Writes are checked against the key's metadata the way a real settings backend checks them.
 * Not thread-safe.
 */
public class InMemorySettingsStore implements SettingsStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySettingsStore.class);

    private final SchemaSource schemas;
    private final Map<String, GValue> values = new HashMap<>();

    public InMemorySettingsStore(SchemaSource schemas) {
        this.schemas = schemas;
    }

    @Override
    public Optional<GValue> read(String schemaId, String keyName, String path) {
        GValue stored = values.get(storageKey(schemaId, keyName, path));
        if (stored != null) {
            return Optional.of(stored);
        }
        return schemas.lookupKey(schemaId, keyName).map(KeyMetadata::getDefaultValue);
    }

    @Override
    public void write(String schemaId, String keyName, String path, GValue value) {
        KeyMetadata key = schemas.lookupKey(schemaId, keyName)
                .orElseThrow(() -> new PersistenceRejectedException(schemaId, keyName,
                        "No key '" + keyName + "' in schema '" + schemaId + "'"));
        if (!key.isWritable()) {
            throw new PersistenceRejectedException(schemaId, keyName, "Key '" + key + "' is not writable");
        }
        if (!value.getSignature().equals(key.getSignature())) {
            throw new PersistenceRejectedException(schemaId, keyName, "Value " + value + " has type '"
                    + value.getSignature() + "', key '" + key + "' expects '" + key.getType() + "'");
        }
        if (!key.getRange().admits(value)) {
            throw new PersistenceRejectedException(schemaId, keyName, "Value " + value
                    + " is outside the permitted " + key.getRange().describe() + " of key '" + key + "'");
        }
        values.put(storageKey(schemaId, keyName, path), value);
        log.debug("Stored {} = {}{}", key, value, path != null ? " at " + path : "");
    }

    /**
     * Store a value without checking it against the key's metadata, the way a value written by
     * another program would appear.
     */
    public void preload(String schemaId, String keyName, String path, GValue value) {
        values.put(storageKey(schemaId, keyName, path), value);
    }

    /**
     * Forget the stored value so the key reads as its default again.
     */
    public void reset(String schemaId, String keyName, String path) {
        values.remove(storageKey(schemaId, keyName, path));
    }

    private static String storageKey(String schemaId, String keyName, String path) {
        return (path == null ? "" : path) + "|" + schemaId + "|" + keyName;
    }
}
