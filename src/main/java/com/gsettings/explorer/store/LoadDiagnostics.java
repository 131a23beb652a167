package com.gsettings.explorer.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Problems collected while loading keys. A key listed here could not be displayed;
 * every other key loaded normally.
 */
@Getter
public class LoadDiagnostics {
    /**
     * Dotted key name to the reason it cannot be displayed.
     */
    private final Map<String, String> failedKeys = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasFailures() {
        return !failedKeys.isEmpty();
    }
}
