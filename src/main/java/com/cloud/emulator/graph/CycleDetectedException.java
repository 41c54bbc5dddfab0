package com.cloud.emulator.graph;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;

/**
 * Thrown when adding an edge would close a directed cycle.
 */
public class CycleDetectedException extends ResourceGraphException {

    private final ResourceId from;
    private final ResourceId to;
    private final RelationshipKind relationshipKind;

    public CycleDetectedException(ResourceId from, ResourceId to, RelationshipKind relationshipKind) {
        super(ErrorKind.WOULD_CREATE_CYCLE,
                "adding edge " + from + " -[" + relationshipKind.getLabel() + "]-> " + to + " would create a cycle");
        this.from = from;
        this.to = to;
        this.relationshipKind = relationshipKind;
    }

    public ResourceId getFrom() {
        return from;
    }

    public ResourceId getTo() {
        return to;
    }

    public RelationshipKind getRelationshipKind() {
        return relationshipKind;
    }
}
