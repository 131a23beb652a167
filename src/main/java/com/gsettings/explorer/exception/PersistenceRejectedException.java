package com.gsettings.explorer.exception;

/**
 * The settings store refused to write a value.
 */
public class PersistenceRejectedException extends ValueTreeException {

    private static final long serialVersionUID = 1L;
    private final String schemaId;
    private final String keyName;

    public PersistenceRejectedException(String schemaId, String keyName, String reason) {
        super(reason);
        this.schemaId = schemaId;
        this.keyName = keyName;
    }

    public String getSchemaId() {
        return schemaId;
    }

    public String getKeyName() {
        return keyName;
    }
}
