package com.cloud.emulator.service;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.DependencyViolationException;
import com.cloud.emulator.graph.ResourceGraphException;
import com.cloud.emulator.graph.ResourceNotFoundException;
import com.cloud.emulator.manager.ResourceManager;
import com.cloud.emulator.state.StateStore;
import com.cloud.emulator.state.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base class for emulated services that keep their records in a {@link StateStore}
 * and mirror resource lifecycles into a {@link ResourceManager}.
 *
 * <p>Registration and relationship failures follow the manager's mode: in strict mode
 * they surface as {@code InternalFailure} so the calling handler rolls back, otherwise
 * they are logged and the call proceeds.</p>
 *
 * <p>Handlers that read a record, check it and then record relationships based on it
 * run that sequence under {@link #withLock} so concurrent calls on the same record
 * cannot interleave between the state write and the graph update.</p>
 */
public abstract class GraphBackedService {
    private static final Logger log = LoggerFactory.getLogger(GraphBackedService.class);

    public static final String INTERNAL_FAILURE = "InternalFailure";

    protected final StateStore state;
    protected final ResourceManager resources;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    protected GraphBackedService(StateStore state, ResourceManager resources) {
        this.state = Objects.requireNonNull(state, "state is required");
        this.resources = Objects.requireNonNull(resources, "resources is required");
    }

    /**
     * Runs {@code action} while holding the in-process lock for {@code key}.
     */
    protected void withLock(String key, Runnable action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes a record if it is still present.
     */
    protected void deleteIfExists(String key) {
        try {
            state.delete(key);
        } catch (StateStoreException e) {
            log.debug("Record {} was already removed", key);
        }
    }

    protected void track(ResourceId id, Map<String, String> metadata) {
        try {
            resources.registerResource(id, metadata);
        } catch (ResourceGraphException e) {
            onBookkeepingFailure("register " + id, e);
        }
    }

    protected void link(ResourceId from, ResourceId to, RelationshipKind kind) {
        try {
            resources.addRelationship(from, to, kind);
        } catch (ResourceGraphException e) {
            onBookkeepingFailure("link " + from + " -[" + kind.getLabel() + "]-> " + to, e);
        }
    }

    protected void unlink(ResourceId from, ResourceId to, RelationshipKind kind) {
        try {
            resources.removeRelationship(from, to, kind);
        } catch (ResourceGraphException e) {
            log.warn("Failed to unlink {} -[{}]-> {}: {}", from, kind.getLabel(), to, e.getMessage());
        }
    }

    /**
     * Unregisters a resource before its record is deleted.
     *
     * @throws ServiceException with the given status and code if dependents still exist
     */
    protected void untrack(ResourceId id, int conflictStatus, String conflictCode) {
        try {
            resources.unregisterResource(id);
        } catch (DependencyViolationException e) {
            throw new ServiceException(conflictStatus, conflictCode, e.getMessage(), e);
        } catch (ResourceNotFoundException e) {
            log.warn("Resource {} was not tracked: {}", id, e.getMessage());
        }
    }

    /**
     * Unregisters a resource while rolling back a failed create. Never throws.
     */
    protected void forget(ResourceId id) {
        try {
            if (resources.hasResource(id)) {
                resources.unregisterResource(id);
            }
        } catch (ResourceGraphException e) {
            log.warn("Failed to unregister {} during rollback: {}", id, e.getMessage());
        }
    }

    private void onBookkeepingFailure(String action, ResourceGraphException e) {
        if (resources.isStrictMode()) {
            throw new ServiceException(500, INTERNAL_FAILURE,
                    "Failed to " + action + ": " + e.getMessage(), e);
        }
        log.warn("Failed to {} (continuing in permissive mode): {}", action, e.getMessage());
    }
}
