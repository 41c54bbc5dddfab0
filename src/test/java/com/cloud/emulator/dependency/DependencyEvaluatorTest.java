package com.cloud.emulator.dependency;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.RelationshipGraph;
import com.cloud.emulator.graph.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cloud.emulator.core.model.RelationshipKind.ASSOCIATED_WITH;
import static com.cloud.emulator.core.model.RelationshipKind.ATTACHED_TO;
import static com.cloud.emulator.core.model.RelationshipKind.CONTAINS;
import static com.cloud.emulator.core.model.RelationshipKind.REFERENCES;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyEvaluator Tests")
class DependencyEvaluatorTest {

    private static final ResourceId VPC = ResourceId.of("ec2", "vpc", "vpc-1");
    private static final ResourceId SUBNET = ResourceId.of("ec2", "subnet", "subnet-1");
    private static final ResourceId POLICY = ResourceId.of("iam", "policy", "read-only");
    private static final ResourceId ROLE = ResourceId.of("iam", "role", "app");
    private static final ResourceId INSTANCE = ResourceId.of("ec2", "instance", "i-1");
    private static final ResourceId GATEWAY = ResourceId.of("ec2", "internet-gateway", "igw-1");

    private final DependencyEvaluator evaluator = new DependencyEvaluator();
    private RelationshipGraph graph;

    @BeforeEach
    void setUp() {
        graph = new RelationshipGraph();
        for (ResourceId id : List.of(VPC, SUBNET, POLICY, ROLE, INSTANCE, GATEWAY)) {
            graph.addNode(id, Map.of());
        }
    }

    @Test
    @DisplayName("Only CONTAINS blocks through outgoing edges")
    void blockingDirections() {
        assertEquals(BlockingDirection.OUTGOING, DependencyEvaluator.blockingDirection(CONTAINS));
        assertEquals(BlockingDirection.INCOMING, DependencyEvaluator.blockingDirection(ASSOCIATED_WITH));
        assertEquals(BlockingDirection.INCOMING, DependencyEvaluator.blockingDirection(REFERENCES));
        assertEquals(BlockingDirection.INCOMING, DependencyEvaluator.blockingDirection(ATTACHED_TO));
    }

    @Test
    @DisplayName("A container with children is blocked; the child is not")
    void containsBlocksContainer() {
        graph.addEdge(VPC, SUBNET, CONTAINS);

        assertEquals(DeletionCheck.blockedBy(VPC, List.of(SUBNET)), evaluator.evaluate(graph, VPC));
        assertTrue(evaluator.evaluate(graph, SUBNET).deletable());
    }

    @Test
    @DisplayName("An associated target is blocked; the attaching side is not")
    void associatedWithBlocksTarget() {
        graph.addEdge(POLICY, ROLE, ASSOCIATED_WITH);

        DeletionCheck roleCheck = evaluator.evaluate(graph, ROLE);
        assertFalse(roleCheck.deletable());
        assertEquals(List.of(POLICY), roleCheck.blockers());
        assertTrue(evaluator.evaluate(graph, POLICY).deletable());
    }

    @Test
    @DisplayName("REFERENCES and ATTACHED_TO block the target")
    void referencesAndAttachedBlockTarget() {
        graph.addEdge(INSTANCE, SUBNET, REFERENCES);
        graph.addEdge(GATEWAY, VPC, ATTACHED_TO);

        assertEquals(List.of(INSTANCE), evaluator.evaluate(graph, SUBNET).blockers());
        assertEquals(List.of(GATEWAY), evaluator.evaluate(graph, VPC).blockers());
        assertTrue(evaluator.evaluate(graph, INSTANCE).deletable());
        assertTrue(evaluator.evaluate(graph, GATEWAY).deletable());
    }

    @Test
    @DisplayName("Blockers are listed in edge insertion order across kinds and directions")
    void blockerOrder() {
        graph.addEdge(GATEWAY, VPC, ATTACHED_TO);
        graph.addEdge(INSTANCE, VPC, REFERENCES);
        graph.addEdge(VPC, SUBNET, CONTAINS);

        assertEquals(List.of(GATEWAY, INSTANCE, SUBNET), evaluator.evaluate(graph, VPC).blockers());
    }

    @Test
    @DisplayName("A policy attached before an access key was created is reported first")
    void attachmentBeforeChild() {
        ResourceId user = ResourceId.of("iam", "user", "alice");
        ResourceId key = ResourceId.of("iam", "access-key", "AKIA1");
        graph.addNode(user, Map.of());
        graph.addNode(key, Map.of());

        graph.addEdge(POLICY, user, ASSOCIATED_WITH);
        graph.addEdge(user, key, CONTAINS);

        assertEquals(List.of(POLICY, key), evaluator.evaluate(graph, user).blockers());
    }

    @Test
    @DisplayName("A removed and re-added edge moves to the end of the order")
    void reinsertedEdgeOrder() {
        graph.addEdge(VPC, SUBNET, CONTAINS);
        graph.addEdge(GATEWAY, VPC, ATTACHED_TO);
        graph.removeEdge(VPC, SUBNET, CONTAINS);
        graph.addEdge(VPC, SUBNET, CONTAINS);

        assertEquals(List.of(GATEWAY, SUBNET), evaluator.evaluate(graph, VPC).blockers());
    }

    @Test
    @DisplayName("A resource blocking through two kinds is reported once")
    void blockersDeduplicated() {
        graph.addEdge(INSTANCE, SUBNET, REFERENCES);
        graph.addEdge(INSTANCE, SUBNET, ASSOCIATED_WITH);

        assertEquals(List.of(INSTANCE), evaluator.evaluate(graph, SUBNET).blockers());
    }

    @Test
    @DisplayName("dependents should return the blockers of a single kind")
    void dependentsPerKind() {
        graph.addEdge(VPC, SUBNET, CONTAINS);
        graph.addEdge(INSTANCE, VPC, RelationshipKind.REFERENCES);

        assertEquals(List.of(SUBNET), List.copyOf(evaluator.dependents(graph, VPC, CONTAINS)));
        assertEquals(List.of(INSTANCE), List.copyOf(evaluator.dependents(graph, VPC, REFERENCES)));
        assertTrue(evaluator.dependents(graph, VPC, ATTACHED_TO).isEmpty());
    }

    @Test
    @DisplayName("Evaluating an unknown resource should fail with NOT_FOUND")
    void unknownResource() {
        assertThrows(ResourceNotFoundException.class,
                () -> evaluator.evaluate(graph, ResourceId.of("ec2", "vpc", "ghost")));
    }

    @Test
    @DisplayName("DeletionCheck should keep deletable consistent with its blockers")
    void deletionCheckInvariant() {
        assertThrows(IllegalArgumentException.class, () -> new DeletionCheck(VPC, true, List.of(SUBNET)));
        assertThrows(IllegalArgumentException.class, () -> new DeletionCheck(VPC, false, List.of()));
        assertEquals(DeletionCheck.allowed(VPC), DeletionCheck.blockedBy(VPC, List.of()));
    }
}
