package com.cloud.emulator.schema;

import com.cloud.emulator.core.model.RelationshipKind;

import java.util.Objects;

/**
 * Legal relationship between two resource types.
 *
 * @param kind        the only relationship kind allowed between the types
 * @param cardinality multiplicity enforced when the edge is inserted
 * @param description human-readable documentation
 */
public record SchemaEntry(RelationshipKind kind, Cardinality cardinality, String description) {

    public SchemaEntry {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(cardinality, "cardinality is required");
        description = description != null ? description : "";
    }
}
