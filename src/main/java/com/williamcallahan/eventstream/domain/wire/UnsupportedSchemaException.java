package com.williamcallahan.eventstream.domain.wire;

/**
 * Thrown when a {@code start} event announces a schema version this code cannot read.
 */
public class UnsupportedSchemaException extends WireFormatException {

    private final String schema;

    public UnsupportedSchemaException(String schema) {
        super("unsupported schema version: " + schema + " (expected " + NormalizedEventTypes.SCHEMA_VERSION + ")");
        this.schema = schema;
    }

    /** The schema value that was rejected, may be null. */
    public String schema() {
        return schema;
    }
}
