package com.cloud.emulator.core.model;

import java.util.Objects;

/**
 * Directed, typed relationship between two registered resources.
 */
public record Edge(ResourceId from, ResourceId to, RelationshipKind kind) {

    public Edge {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    @Override
    public String toString() {
        return from + " -[" + kind.getLabel() + "]-> " + to;
    }
}
