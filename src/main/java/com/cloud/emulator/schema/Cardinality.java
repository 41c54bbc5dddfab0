package com.cloud.emulator.schema;

/**
 * Multiplicity constraint of a schema relationship, read from the
 * perspective of the edge direction (source to target).
 */
public enum Cardinality {
    /** A source links to at most one target of the type, and a target to at most one source. */
    ONE_TO_ONE("one-to-one"),

    /** A target is linked from at most one source of the type. */
    ONE_TO_MANY("one-to-many"),

    /** A source links to at most one target of the type. */
    MANY_TO_ONE("many-to-one"),

    /** No constraint. */
    MANY_TO_MANY("many-to-many");

    private final String label;

    Cardinality(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether a source may link to only one target of the same type.
     */
    public boolean singleTargetPerSource() {
        return this == ONE_TO_ONE || this == MANY_TO_ONE;
    }

    /**
     * Whether a target may be linked from only one source of the same type.
     */
    public boolean singleSourcePerTarget() {
        return this == ONE_TO_ONE || this == ONE_TO_MANY;
    }
}
