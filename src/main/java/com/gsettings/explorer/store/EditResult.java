package com.gsettings.explorer.store;

import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.value.GValue;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of committing one leaf edit.
 */
@Data
@Builder
public class EditResult {
    private boolean success;
    private GValue committedValue;
    private String errorMessage;

    /**
     * The failure, when one was raised; null on success and for failures detected before recomposing.
     */
    private ValueTreeException error;

    public static EditResult success(GValue committedValue) {
        return EditResult.builder()
                .success(true)
                .committedValue(committedValue)
                .build();
    }

    public static EditResult failure(String errorMessage) {
        return EditResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static EditResult failure(ValueTreeException error) {
        return EditResult.builder()
                .success(false)
                .errorMessage(error.getMessage())
                .error(error)
                .build();
    }
}
