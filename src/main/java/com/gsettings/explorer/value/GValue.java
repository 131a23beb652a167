package com.gsettings.explorer.value;

import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.text.ValueFormatter;

/**
 * Base class for immutable encoded values. Every value knows its own type signature.
 */
public abstract class GValue {

    public abstract TypeSignature getSignature();

    public abstract <R> R accept(GValueVisitor<R> visitor);

    /**
     * The value in text notation, e.g. {@code [1, 2]} or {@code {'a': <true>}}.
     */
    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }
}
