package com.gsettings.explorer.model;

import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.GValue;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Descriptive data for one settings key, as supplied by the schema source.
 */
@Value
@Builder(toBuilder = true)
public class KeyMetadata {
    @NonNull
    String schemaId;
    @NonNull
    String keyName;
    /**
     * Type signature string as declared by the schema.
     */
    @NonNull
    String type;
    GValue defaultValue;
    @Builder.Default
    ValueRange range = ValueRange.none();
    String summary;
    String description;
    @Builder.Default
    boolean writable = true;

    /**
     * The declared type, parsed.
     *
     * @throws com.gsettings.explorer.exception.MalformedSignatureException when the declared type is not valid
     */
    public TypeSignature getSignature() {
        return TypeSignature.parse(type);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        return schemaId + "." + keyName;
    }
}
