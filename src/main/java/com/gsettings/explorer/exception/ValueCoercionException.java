package com.gsettings.explorer.exception;

import com.gsettings.explorer.signature.TypeKind;

/**
 * Edited leaf text cannot be converted to the primitive type of its slot.
 */
public class ValueCoercionException extends ValueTreeException {

    private static final long serialVersionUID = 1L;
    private final TypeKind targetKind;
    private final String text;

    public ValueCoercionException(TypeKind targetKind, String text, String reason) {
        super("Cannot convert '" + text + "' to " + targetKind.getDisplayName() + ": " + reason);
        this.targetKind = targetKind;
        this.text = text;
    }

    public ValueCoercionException(TypeKind targetKind, String text, String reason, Throwable cause) {
        super("Cannot convert '" + text + "' to " + targetKind.getDisplayName() + ": " + reason, cause);
        this.targetKind = targetKind;
        this.text = text;
    }

    public TypeKind getTargetKind() {
        return targetKind;
    }

    public String getText() {
        return text;
    }
}
