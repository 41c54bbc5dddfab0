package com.cloud.emulator.schema;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.SchemaViolationException;

import java.util.Optional;

/**
 * Decides whether a relationship between two resources corresponds to a
 * real provider relationship. Consulted by the graph before an edge is accepted.
 */
public interface SchemaValidator {

    /**
     * Validates a relationship.
     *
     * @return the schema entry governing the relationship, or empty when the
     *         validator does not constrain relationships
     * @throws SchemaViolationException if the relationship is not legal
     */
    Optional<SchemaEntry> validate(ResourceId from, ResourceId to, RelationshipKind kind);

    /**
     * Boolean form of {@link #validate}.
     */
    default boolean isLegal(ResourceId from, ResourceId to, RelationshipKind kind) {
        try {
            validate(from, to, kind);
            return true;
        } catch (SchemaViolationException e) {
            return false;
        }
    }

    /**
     * Returns a validator that accepts every relationship.
     */
    static SchemaValidator permissive() {
        return PermissiveSchemaValidator.INSTANCE;
    }
}
