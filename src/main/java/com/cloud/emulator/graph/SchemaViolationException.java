package com.cloud.emulator.graph;

/**
 * Thrown when a relationship is not legal under the configured schema,
 * either because the type pair is unknown, the kind does not match, or the
 * edge would break a cardinality constraint.
 */
public class SchemaViolationException extends ResourceGraphException {

    private final String relationshipKey;

    public SchemaViolationException(String relationshipKey, String message) {
        super(ErrorKind.SCHEMA_VIOLATION, message);
        this.relationshipKey = relationshipKey;
    }

    /**
     * Returns the {@code fromService:fromType -> toService:toType} key that was rejected.
     */
    public String getRelationshipKey() {
        return relationshipKey;
    }
}
