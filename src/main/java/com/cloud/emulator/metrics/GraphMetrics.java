package com.cloud.emulator.metrics;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.ErrorKind;

/**
 * Interface for recording resource graph metrics.
 * The default {@link NoOpGraphMetrics} does nothing, so the graph works
 * without a metrics registry.
 */
public interface GraphMetrics {

    void incrementRegistered(ResourceId id);

    void incrementUnregistered(ResourceId id);

    void incrementRelationshipAdded(RelationshipKind kind);

    void incrementRelationshipRejected(RelationshipKind kind, ErrorKind reason);

    void incrementDeleteBlocked(ResourceId id);
}
