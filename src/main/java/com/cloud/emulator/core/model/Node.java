package com.cloud.emulator.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A registered resource in the relationship graph.
 *
 * Metadata is free-form and carries no graph semantics; deletion policies
 * in the service handlers read it (for example the {@code default} flag).
 */
public final class Node {

    public static final String DEFAULT_FLAG = "default";

    private final ResourceId id;
    private final Map<String, String> metadata;
    private final Instant createdAt;

    public Node(ResourceId id, Map<String, String> metadata) {
        this(id, metadata, Instant.now());
    }

    public Node(ResourceId id, Map<String, String> metadata, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public ResourceId getId() {
        return id;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns true for provider-seeded resources that must never be deleted.
     */
    public boolean isDefault() {
        return "true".equals(metadata.get(DEFAULT_FLAG));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id=" + id +
                ", metadata=" + metadata +
                '}';
    }
}
