package com.gsettings.explorer.store;

import com.gsettings.explorer.model.KeyMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema source backed by maps, in registration order.
 */
public class InMemorySchemaSource implements SchemaSource {

    private final Map<String, Map<String, KeyMetadata>> schemas = new LinkedHashMap<>();

    public InMemorySchemaSource register(KeyMetadata key) {
        schemas.computeIfAbsent(key.getSchemaId(), id -> new LinkedHashMap<>()).put(key.getKeyName(), key);
        return this;
    }

    @Override
    public List<String> listSchemas() {
        return new ArrayList<>(schemas.keySet());
    }

    @Override
    public List<String> listKeys(String schemaId) {
        Map<String, KeyMetadata> keys = schemas.get(schemaId);
        return keys == null ? List.of() : new ArrayList<>(keys.keySet());
    }

    @Override
    public Optional<KeyMetadata> lookupKey(String schemaId, String keyName) {
        Map<String, KeyMetadata> keys = schemas.get(schemaId);
        return keys == null ? Optional.empty() : Optional.ofNullable(keys.get(keyName));
    }
}
