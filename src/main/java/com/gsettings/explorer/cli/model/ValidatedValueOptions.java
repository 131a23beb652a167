package com.gsettings.explorer.cli.model;

import com.gsettings.explorer.ExplorerConfig;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.value.GValue;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Parsed and checked form of {@link ValueOptions}.
 */
@Data
@AllArgsConstructor
public class ValidatedValueOptions {
    private KeyMetadata key;

    /**
     * Null when the key has no value of its own.
     */
    private GValue value;

    private ExplorerConfig config;
}
