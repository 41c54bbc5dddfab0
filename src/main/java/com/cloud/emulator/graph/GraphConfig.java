package com.cloud.emulator.graph;

import com.cloud.emulator.schema.SchemaValidator;

import java.util.Objects;

/**
 * Configuration for a {@link RelationshipGraph}.
 *
 * @param detectCycles    reject edges that would close a directed cycle
 * @param schemaValidator consulted before every edge insertion
 */
public record GraphConfig(boolean detectCycles, SchemaValidator schemaValidator) {

    public GraphConfig {
        Objects.requireNonNull(schemaValidator, "schemaValidator is required");
    }

    /**
     * Default configuration: cycle detection on, no schema constraints.
     */
    public static GraphConfig defaults() {
        return new GraphConfig(true, SchemaValidator.permissive());
    }
}
