package com.gsettings.explorer.store;

import com.gsettings.explorer.exception.PersistenceRejectedException;
import com.gsettings.explorer.value.GValue;

import java.util.Optional;

/**
 * Backend holding the current value of each settings key.
 *
 * {@code path} is the relocation path of a relocatable schema, or null for a fixed schema.
 */
public interface SettingsStore {

    Optional<GValue> read(String schemaId, String keyName, String path);

    /**
     * Store a complete value for a key.
     *
     * @throws PersistenceRejectedException when the key is unknown or read-only, or the value does
     *                                      not have the key's type or lies outside its declared range
     */
    void write(String schemaId, String keyName, String path, GValue value);
}
