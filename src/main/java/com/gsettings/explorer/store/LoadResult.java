package com.gsettings.explorer.store;

import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Key trees built by {@link SettingsLoader}, plus the keys that had no value and the diagnostics.
 */
@Getter
public class LoadResult {
    private final List<KeyTree> trees = new ArrayList<>();
    private final List<KeyMetadata> keysWithoutValue = new ArrayList<>();
    private final LoadDiagnostics diagnostics = new LoadDiagnostics();

    public Optional<KeyTree> find(String schemaId, String keyName) {
        return trees.stream()
                .filter(t -> t.getMetadata().getSchemaId().equals(schemaId)
                        && t.getMetadata().getKeyName().equals(keyName))
                .findFirst();
    }
}
