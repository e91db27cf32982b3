package com.airsentinel.core.error;

public class SchemaException extends AirQualityException {
    private final SchemaReason schemaReason;

    public SchemaException(SchemaReason schemaReason, String message) {
        super(schemaReason.wireName() + ": " + message);
        this.schemaReason = schemaReason;
    }

    public SchemaException(SchemaReason schemaReason, String message, Throwable cause) {
        super(schemaReason.wireName() + ": " + message, cause);
        this.schemaReason = schemaReason;
    }

    public static SchemaException missingField(String field) {
        return new SchemaException(SchemaReason.MISSING_FIELD, "record has no " + field);
    }

    public SchemaReason schemaReason() {
        return schemaReason;
    }

    @Override
    public String kind() {
        return "schema_error";
    }

    @Override
    public String reason() {
        return schemaReason.wireName();
    }
}
