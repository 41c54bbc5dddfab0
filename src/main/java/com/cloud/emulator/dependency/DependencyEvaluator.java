package com.cloud.emulator.dependency;

import com.cloud.emulator.core.model.Edge;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.RelationshipGraph;
import com.cloud.emulator.graph.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides whether a resource may be deleted.
 *
 * <p>Relationship kinds block deletion in opposite directions:</p>
 * <ul>
 *   <li>{@link RelationshipKind#CONTAINS}: a container cannot be deleted while it still
 *       has children, so the blockers are the targets of its outgoing edges.</li>
 *   <li>{@link RelationshipKind#ASSOCIATED_WITH}, {@link RelationshipKind#REFERENCES},
 *       {@link RelationshipKind#ATTACHED_TO}: a target cannot be deleted while something
 *       is still attached, so the blockers are the sources of its incoming edges.</li>
 * </ul>
 *
 * <p>Blockers are reported in the order their edges were inserted, whatever their kind.
 * Provider defaults that may never be deleted are a caller-side check, not part of this evaluation.</p>
 */
public class DependencyEvaluator {

    /**
     * Returns the direction in which edges of {@code kind} block deletion.
     */
    public static BlockingDirection blockingDirection(RelationshipKind kind) {
        return switch (kind) {
            case CONTAINS -> BlockingDirection.OUTGOING;
            case ASSOCIATED_WITH, REFERENCES, ATTACHED_TO -> BlockingDirection.INCOMING;
        };
    }

    /**
     * Evaluates whether {@code id} may be deleted right now.
     *
     * @throws ResourceNotFoundException if {@code id} is not registered
     */
    public DeletionCheck evaluate(RelationshipGraph graph, ResourceId id) {
        if (!graph.hasNode(id)) {
            throw new ResourceNotFoundException(id);
        }
        Set<ResourceId> blockers = new LinkedHashSet<>();
        for (Edge edge : graph.incidentEdges(id)) {
            BlockingDirection direction = blockingDirection(edge.kind());
            if (direction == BlockingDirection.OUTGOING && edge.from().equals(id)) {
                blockers.add(edge.to());
            } else if (direction == BlockingDirection.INCOMING && edge.to().equals(id)) {
                blockers.add(edge.from());
            }
        }
        return DeletionCheck.blockedBy(id, new ArrayList<>(blockers));
    }

    /**
     * Returns the resources that block deletion of {@code id} through edges of {@code kind}.
     */
    public Set<ResourceId> dependents(RelationshipGraph graph, ResourceId id, RelationshipKind kind) {
        return switch (blockingDirection(kind)) {
            case OUTGOING -> graph.outgoing(id, kind);
            case INCOMING -> graph.incoming(id, kind);
        };
    }
}
