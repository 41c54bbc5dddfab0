package com.cloud.emulator.dependency;

import com.cloud.emulator.core.model.ResourceId;

import java.util.List;
import java.util.Objects;

/**
 * Result of a deletability check.
 *
 * @param resource  the resource that was evaluated
 * @param deletable true when nothing blocks deletion
 * @param blockers  resources currently preventing deletion, in edge insertion order
 */
public record DeletionCheck(ResourceId resource, boolean deletable, List<ResourceId> blockers) {

    public DeletionCheck {
        Objects.requireNonNull(resource, "resource is required");
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
        if (deletable != blockers.isEmpty()) {
            throw new IllegalArgumentException("deletable must be true exactly when there are no blockers");
        }
    }

    public static DeletionCheck allowed(ResourceId resource) {
        return new DeletionCheck(resource, true, List.of());
    }

    public static DeletionCheck blockedBy(ResourceId resource, List<ResourceId> blockers) {
        return new DeletionCheck(resource, blockers.isEmpty(), blockers);
    }
}
