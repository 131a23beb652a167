package com.gsettings.explorer.store;

import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.tree.Decomposer;
import com.gsettings.explorer.value.GValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds a value tree for every key of every schema.
 *
 * A key whose value cannot be decomposed is reported in the diagnostics and skipped;
 * it does not stop the remaining keys from loading.
 */
public class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final Decomposer decomposer = new Decomposer();

    public LoadResult load(SchemaSource schemas, SettingsStore store, String path) {
        LoadResult result = new LoadResult();
        for (String schemaId : schemas.listSchemas()) {
            for (String keyName : schemas.listKeys(schemaId)) {
                Optional<KeyMetadata> metadata = schemas.lookupKey(schemaId, keyName);
                if (metadata.isEmpty()) {
                    result.getDiagnostics().getWarnings().add("Key " + schemaId + "." + keyName + " is listed but has no metadata");
                    continue;
                }
                loadKey(metadata.get(), store, path, result);
            }
        }
        log.debug("Loaded {} key(s), {} without value, {} failed", result.getTrees().size(),
                result.getKeysWithoutValue().size(), result.getDiagnostics().getFailedKeys().size());
        return result;
    }

    private void loadKey(KeyMetadata key, SettingsStore store, String path, LoadResult result) {
        try {
            Optional<GValue> value = store.read(key.getSchemaId(), key.getKeyName(), path);
            if (value.isEmpty()) {
                result.getKeysWithoutValue().add(key);
                return;
            }
            result.getTrees().add(decomposer.decomposeKey(key, value.get()));
        } catch (ValueTreeException e) {
            log.warn("Cannot display key {}: {}", key, e.getMessage());
            result.getDiagnostics().getFailedKeys().put(key.toString(), e.getMessage());
        }
    }
}
