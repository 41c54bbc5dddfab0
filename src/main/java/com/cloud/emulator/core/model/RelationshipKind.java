package com.cloud.emulator.core.model;

/**
 * Semantic meaning of a directed edge between two resources.
 * Each kind blocks deletion in a fixed direction; see
 * {@link com.cloud.emulator.dependency.DependencyEvaluator}.
 */
public enum RelationshipKind {
    /** Parent owns child, e.g. VPC contains subnet. Blocks the container. */
    CONTAINS("contains"),

    /** Attachment without ownership, e.g. policy attached to role. Blocks the target. */
    ASSOCIATED_WITH("associated_with"),

    /** One resource uses another, e.g. instance references security group. Blocks the target. */
    REFERENCES("references"),

    /** Detachable attachment, e.g. internet gateway attached to VPC. Blocks the target. */
    ATTACHED_TO("attached_to");

    private final String label;

    RelationshipKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
