package com.gsettings.explorer;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for loading and displaying value trees.
 */
@Data
@Builder
public class ExplorerConfig {
    public static final int DEFAULT_INDENT_WIDTH = 2;
    public static final int DEFAULT_MAX_VALUE_LENGTH = 60;

    /**
     * Path of a relocatable schema instance; null for fixed schemas.
     */
    private String relocationPath;

    @Builder.Default
    private int indentWidth = DEFAULT_INDENT_WIDTH;

    @Builder.Default
    private boolean showTypes = true;

    /**
     * Leaf text longer than this is cut and ends in "..."; zero or less disables truncation.
     */
    @Builder.Default
    private int maxValueLength = DEFAULT_MAX_VALUE_LENGTH;

    public static ExplorerConfig defaults() {
        return ExplorerConfig.builder().build();
    }
}
