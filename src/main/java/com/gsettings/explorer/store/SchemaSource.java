package com.gsettings.explorer.store;

import com.gsettings.explorer.model.KeyMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Registry of schemas and the metadata of their keys.
 */
public interface SchemaSource {

    List<String> listSchemas();

    List<String> listKeys(String schemaId);

    Optional<KeyMetadata> lookupKey(String schemaId, String keyName);
}
