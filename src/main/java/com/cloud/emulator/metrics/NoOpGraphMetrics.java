package com.cloud.emulator.metrics;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.ErrorKind;

/**
 * No-op implementation of {@link GraphMetrics}.
 */
public class NoOpGraphMetrics implements GraphMetrics {

    @Override
    public void incrementRegistered(ResourceId id) {
    }

    @Override
    public void incrementUnregistered(ResourceId id) {
    }

    @Override
    public void incrementRelationshipAdded(RelationshipKind kind) {
    }

    @Override
    public void incrementRelationshipRejected(RelationshipKind kind, ErrorKind reason) {
    }

    @Override
    public void incrementDeleteBlocked(ResourceId id) {
    }
}
