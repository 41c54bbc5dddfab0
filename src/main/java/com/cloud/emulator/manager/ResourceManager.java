package com.cloud.emulator.manager;

import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.dependency.DeletionCheck;
import com.cloud.emulator.graph.CycleDetectedException;
import com.cloud.emulator.graph.DependencyViolationException;
import com.cloud.emulator.graph.ResourceAlreadyExistsException;
import com.cloud.emulator.graph.ResourceNotFoundException;
import com.cloud.emulator.graph.SchemaViolationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point service handlers use to keep the resource relationship graph
 * in step with their own state.
 *
 * <p>Handlers call {@link #registerResource} right after persisting a new record,
 * {@link #unregisterResource} before deleting one (aborting the delete if it throws),
 * and {@link #addRelationship}/{@link #removeRelationship} whenever their attachment
 * bookkeeping changes.</p>
 *
 * <p>When {@link #isStrictMode()} is true, a caller whose relationship bookkeeping fails
 * must revert its own state mutation and report the failure. Otherwise it may log the
 * failure and carry on. Dependency violations on delete are always reported.</p>
 *
 * <p>Implementations are safe for concurrent use.</p>
 */
public interface ResourceManager {

    /**
     * Registers a resource.
     *
     * @throws ResourceAlreadyExistsException if the identity is already registered
     */
    void registerResource(ResourceId id, Map<String, String> metadata);

    /**
     * Removes a resource and all of its relationships, provided nothing blocks its deletion.
     *
     * @throws DependencyViolationException if other resources still depend on it
     * @throws ResourceNotFoundException    if the resource is not registered
     */
    void unregisterResource(ResourceId id);

    /**
     * Adds a relationship. Adding an existing relationship is a no-op.
     *
     * @throws ResourceNotFoundException if either endpoint is not registered
     * @throws SchemaViolationException  if the schema rejects the relationship
     * @throws CycleDetectedException    if the relationship would close a cycle
     */
    void addRelationship(ResourceId from, ResourceId to, RelationshipKind kind);

    /**
     * Removes a relationship. Missing relationships are ignored.
     */
    void removeRelationship(ResourceId from, ResourceId to, RelationshipKind kind);

    /**
     * Evaluates whether a resource may be deleted right now.
     *
     * @throws ResourceNotFoundException if the resource is not registered
     */
    DeletionCheck canDelete(ResourceId id);

    /**
     * Returns the configured consistency policy.
     */
    boolean isStrictMode();

    boolean hasResource(ResourceId id);

    Optional<Node> getResource(ResourceId id);

    /**
     * Returns the resources that currently block deletion of {@code id}.
     */
    default List<ResourceId> directDependents(ResourceId id) {
        return canDelete(id).blockers();
    }

    /**
     * Returns every resource that transitively points at {@code id}.
     */
    List<ResourceId> transitiveDependents(ResourceId id);

    /**
     * Returns every resource {@code id} transitively points at.
     */
    List<ResourceId> transitiveDependencies(ResourceId id);

    int resourceCount();

    int relationshipCount();
}
