package com.cloud.emulator.manager;

import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.dependency.DeletionCheck;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * No-op resource manager. Every operation succeeds and every resource is deletable.
 * Used when a service is built without dependency tracking, so it behaves like a
 * provider with no cross-resource constraints.
 */
public class NoOpResourceManager implements ResourceManager {

    @Override
    public void registerResource(ResourceId id, Map<String, String> metadata) {
        // no-op
    }

    @Override
    public void unregisterResource(ResourceId id) {
        // no-op
    }

    @Override
    public void addRelationship(ResourceId from, ResourceId to, RelationshipKind kind) {
        // no-op
    }

    @Override
    public void removeRelationship(ResourceId from, ResourceId to, RelationshipKind kind) {
        // no-op
    }

    @Override
    public DeletionCheck canDelete(ResourceId id) {
        return DeletionCheck.allowed(id);
    }

    @Override
    public boolean isStrictMode() {
        return false;
    }

    @Override
    public boolean hasResource(ResourceId id) {
        return false;
    }

    @Override
    public Optional<Node> getResource(ResourceId id) {
        return Optional.empty();
    }

    @Override
    public List<ResourceId> transitiveDependents(ResourceId id) {
        return List.of();
    }

    @Override
    public List<ResourceId> transitiveDependencies(ResourceId id) {
        return List.of();
    }

    @Override
    public int resourceCount() {
        return 0;
    }

    @Override
    public int relationshipCount() {
        return 0;
    }
}
