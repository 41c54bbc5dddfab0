package com.cloud.emulator.manager;

import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.dependency.DeletionCheck;
import com.cloud.emulator.graph.CycleDetectedException;
import com.cloud.emulator.graph.DependencyViolationException;
import com.cloud.emulator.graph.ErrorKind;
import com.cloud.emulator.graph.ResourceAlreadyExistsException;
import com.cloud.emulator.graph.ResourceNotFoundException;
import com.cloud.emulator.graph.SchemaViolationException;
import com.cloud.emulator.metrics.GraphMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.cloud.emulator.core.model.RelationshipKind.ASSOCIATED_WITH;
import static com.cloud.emulator.core.model.RelationshipKind.CONTAINS;
import static com.cloud.emulator.core.model.RelationshipKind.REFERENCES;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("GraphResourceManager Tests")
class GraphResourceManagerTest {

    private static final ResourceId VPC = ResourceId.of("ec2", "vpc", "vpc-1");
    private static final ResourceId SUBNET = ResourceId.of("ec2", "subnet", "subnet-1");
    private static final ResourceId POLICY = ResourceId.of("iam", "policy", "read-only");
    private static final ResourceId ROLE = ResourceId.of("iam", "role", "app");

    private ResourceManager manager;

    @BeforeEach
    void setUp() {
        manager = ResourceManagers.create(ResourceManagerConfig.defaults());
    }

    @Nested
    @DisplayName("Graph invariants")
    class Invariants {

        @Test
        @DisplayName("Relationships to unregistered resources should fail with NOT_FOUND")
        void noDanglingEdges() {
            manager.registerResource(VPC, Map.of());

            ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                    () -> manager.addRelationship(VPC, SUBNET, CONTAINS));
            assertEquals(ErrorKind.NOT_FOUND, e.kind());
            assertEquals(0, manager.relationshipCount());
        }

        @Test
        @DisplayName("Identities are unique until unregistered")
        void identityUniqueness() {
            manager.registerResource(VPC, Map.of());

            assertThrows(ResourceAlreadyExistsException.class, () -> manager.registerResource(VPC, Map.of()));

            manager.unregisterResource(VPC);
            assertDoesNotThrow(() -> manager.registerResource(VPC, Map.of()));
        }

        @Test
        @DisplayName("Containment blocks the container until the child is gone")
        void containsBlocksContainer() {
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());
            manager.addRelationship(VPC, SUBNET, CONTAINS);

            DeletionCheck blocked = manager.canDelete(VPC);
            assertFalse(blocked.deletable());
            assertEquals(List.of(SUBNET), blocked.blockers());

            manager.unregisterResource(SUBNET);

            assertTrue(manager.canDelete(VPC).deletable());
            assertEquals(0, manager.relationshipCount());
        }

        @Test
        @DisplayName("Association blocks the target but not the attaching side")
        void associationBlocksTarget() {
            manager.registerResource(POLICY, Map.of());
            manager.registerResource(ROLE, Map.of());
            manager.addRelationship(POLICY, ROLE, ASSOCIATED_WITH);

            assertEquals(List.of(POLICY), manager.canDelete(ROLE).blockers());
            assertEquals(List.of(POLICY), manager.directDependents(ROLE));
            assertTrue(manager.canDelete(POLICY).deletable());
        }

        @Test
        @DisplayName("Closing a cycle should fail and leave the graph unchanged")
        void cycleRejection() {
            ResourceManager permissive = ResourceManagers.create(
                    new ResourceManagerConfig(false, true, false));
            ResourceId a = ResourceId.of("test", "node", "a");
            ResourceId b = ResourceId.of("test", "node", "b");
            ResourceId c = ResourceId.of("test", "node", "c");
            permissive.registerResource(a, Map.of());
            permissive.registerResource(b, Map.of());
            permissive.registerResource(c, Map.of());
            permissive.addRelationship(a, b, CONTAINS);
            permissive.addRelationship(b, c, CONTAINS);

            assertThrows(CycleDetectedException.class, () -> permissive.addRelationship(c, a, CONTAINS));
            assertEquals(2, permissive.relationshipCount());
            assertTrue(permissive.canDelete(c).deletable());
        }

        @Test
        @DisplayName("Adding the same relationship twice leaves one edge")
        void idempotentAdd() {
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());

            manager.addRelationship(VPC, SUBNET, CONTAINS);
            manager.addRelationship(VPC, SUBNET, CONTAINS);

            assertEquals(1, manager.relationshipCount());
        }

        @Test
        @DisplayName("Provider schema rejects relationships it does not declare")
        void providerSchemaEnforced() {
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());

            assertThrows(SchemaViolationException.class, () -> manager.addRelationship(SUBNET, VPC, CONTAINS));
        }

        @Test
        @DisplayName("Removing a missing relationship is not an error")
        void removeMissingRelationship() {
            manager.registerResource(VPC, Map.of());
            assertDoesNotThrow(() -> manager.removeRelationship(VPC, SUBNET, CONTAINS));
        }

        @Test
        @DisplayName("canDelete on an unknown resource should fail with NOT_FOUND")
        void canDeleteUnknown() {
            assertThrows(ResourceNotFoundException.class, () -> manager.canDelete(VPC));
            assertThrows(ResourceNotFoundException.class, () -> manager.unregisterResource(VPC));
        }
    }

    @Nested
    @DisplayName("Unregister")
    class Unregister {

        @Test
        @DisplayName("Blocked unregister should report the blockers and keep the resource")
        void blockedUnregister() {
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());
            manager.addRelationship(VPC, SUBNET, CONTAINS);

            DependencyViolationException e = assertThrows(DependencyViolationException.class,
                    () -> manager.unregisterResource(VPC));

            assertEquals(ErrorKind.DEPENDENCY_VIOLATION, e.kind());
            assertEquals(VPC, e.getResource());
            assertEquals(List.of(SUBNET), e.getBlockers());
            assertEquals("cannot delete ec2:vpc:vpc-1: 1 dependent(s) exist [ec2:subnet:subnet-1]", e.getMessage());
            assertTrue(manager.hasResource(VPC));
            assertEquals(1, manager.relationshipCount());
        }

        @Test
        @DisplayName("Walkthrough: network with one subnet")
        void networkWalkthrough() {
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());
            manager.addRelationship(VPC, SUBNET, CONTAINS);

            assertEquals(DeletionCheck.blockedBy(VPC, List.of(SUBNET)), manager.canDelete(VPC));

            manager.unregisterResource(SUBNET);
            assertEquals(DeletionCheck.allowed(VPC), manager.canDelete(VPC));

            manager.unregisterResource(VPC);
            assertFalse(manager.hasResource(VPC));
            assertEquals(0, manager.resourceCount());
        }
    }

    @Nested
    @DisplayName("Default network topology")
    class DefaultTopology {

        @Test
        @DisplayName("A fresh network manager should hold the default VPC and its four children")
        void seededTopology() {
            ResourceManager network = ResourceManagers.forNetworkService(ResourceManagerConfig.defaults());

            assertTrue(network.hasResource(DefaultNetworkTopology.DEFAULT_VPC));
            for (ResourceId child : DefaultNetworkTopology.DEFAULT_VPC_CHILDREN) {
                assertTrue(network.hasResource(child), child.toString());
                assertTrue(network.getResource(child).orElseThrow().isDefault());
            }
            DeletionCheck check = network.canDelete(DefaultNetworkTopology.DEFAULT_VPC);
            assertEquals(4, check.blockers().size());
            assertEquals(DefaultNetworkTopology.DEFAULT_VPC_CHILDREN, check.blockers());
            assertEquals(5, network.resourceCount());
            assertEquals(4, network.relationshipCount());
        }

        @Test
        @DisplayName("A failing seed should propagate its exception")
        void failingSeed() {
            GraphResourceManager.Builder builder = GraphResourceManager.builder()
                    .seed(m -> {
                        throw new IllegalStateException("seed failed");
                    });
            assertThrows(IllegalStateException.class, builder::build);
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Transitive queries should follow edges of every kind")
        void transitive() {
            ResourceId instance = ResourceId.of("ec2", "instance", "i-1");
            manager.registerResource(VPC, Map.of());
            manager.registerResource(SUBNET, Map.of());
            manager.registerResource(instance, Map.of());
            manager.addRelationship(VPC, SUBNET, CONTAINS);
            manager.addRelationship(instance, SUBNET, REFERENCES);

            assertEquals(List.of(VPC, instance), manager.transitiveDependents(SUBNET));
            assertEquals(List.of(SUBNET), manager.transitiveDependencies(instance));
        }

        @Test
        @DisplayName("Strict mode should follow the configuration")
        void strictMode() {
            assertFalse(manager.isStrictMode());
            assertTrue(ResourceManagers.create(ResourceManagerConfig.strict()).isStrictMode());
            assertTrue(ResourceManagerConfig.defaults().withStrictValidation(true).strictValidation());
        }

        @Test
        @DisplayName("getResource should return the registered metadata")
        void getResource() {
            manager.registerResource(VPC, Map.of("cidrBlock", "10.0.0.0/16"));

            assertEquals("10.0.0.0/16", manager.getResource(VPC).orElseThrow().getMetadata().get("cidrBlock"));
            assertTrue(manager.getResource(SUBNET).isEmpty());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Manager should report lifecycle events to its metrics")
        void reportsEvents() {
            GraphMetrics metrics = mock(GraphMetrics.class);
            ResourceManager observed = ResourceManagers.create(ResourceManagerConfig.defaults(), metrics);

            observed.registerResource(VPC, Map.of());
            observed.registerResource(SUBNET, Map.of());
            observed.addRelationship(VPC, SUBNET, CONTAINS);
            assertThrows(SchemaViolationException.class, () -> observed.addRelationship(SUBNET, VPC, CONTAINS));
            assertThrows(DependencyViolationException.class, () -> observed.unregisterResource(VPC));
            observed.unregisterResource(SUBNET);

            verify(metrics).incrementRegistered(VPC);
            verify(metrics).incrementRegistered(SUBNET);
            verify(metrics).incrementRelationshipAdded(CONTAINS);
            verify(metrics).incrementRelationshipRejected(CONTAINS, ErrorKind.SCHEMA_VIOLATION);
            verify(metrics).incrementDeleteBlocked(VPC);
            verify(metrics).incrementUnregistered(SUBNET);
            verify(metrics, never()).incrementUnregistered(VPC);
        }

        @Test
        @DisplayName("Failed registration should not be counted")
        void failedRegistrationNotCounted() {
            GraphMetrics metrics = mock(GraphMetrics.class);
            ResourceManager observed = ResourceManagers.create(ResourceManagerConfig.defaults(), metrics);
            observed.registerResource(VPC, Map.of());

            assertThrows(ResourceAlreadyExistsException.class, () -> observed.registerResource(VPC, Map.of()));
            verify(metrics).incrementRegistered(any());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent registrations and relationships should all be recorded")
        void concurrentMutations() throws Exception {
            ResourceManager shared = ResourceManagers.create(ResourceManagerConfig.defaults());
            shared.registerResource(VPC, Map.of());
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    int thread = t;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            ResourceId subnet = ResourceId.of("ec2", "subnet", "subnet-" + thread + "-" + i);
                            shared.registerResource(subnet, Map.of());
                            shared.addRelationship(VPC, subnet, CONTAINS);
                            shared.canDelete(VPC);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(threads * perThread + 1, shared.resourceCount());
            assertEquals(threads * perThread, shared.canDelete(VPC).blockers().size());
        }

        @Test
        @DisplayName("Concurrent unregister and relationship add never leave a dangling edge")
        void unregisterRacesWithAdd() throws Exception {
            ResourceManager shared = ResourceManagers.create(
                    new ResourceManagerConfig(false, true, false));
            int rounds = 200;
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                for (int i = 0; i < rounds; i++) {
                    ResourceId parent = ResourceId.of("test", "parent", "p-" + i);
                    ResourceId child = ResourceId.of("test", "child", "c-" + i);
                    shared.registerResource(parent, Map.of());
                    shared.registerResource(child, Map.of());
                    CountDownLatch start = new CountDownLatch(1);

                    Future<?> link = executor.submit(() -> {
                        start.await();
                        try {
                            shared.addRelationship(parent, child, CONTAINS);
                        } catch (ResourceNotFoundException e) {
                            // parent already removed
                        }
                        return null;
                    });
                    Future<?> remove = executor.submit(() -> {
                        start.await();
                        try {
                            shared.unregisterResource(parent);
                        } catch (DependencyViolationException e) {
                            // child linked first
                        }
                        return null;
                    });
                    start.countDown();
                    link.get(10, TimeUnit.SECONDS);
                    remove.get(10, TimeUnit.SECONDS);

                    if (shared.hasResource(parent)) {
                        assertEquals(List.of(child), shared.canDelete(parent).blockers());
                    } else {
                        assertTrue(shared.transitiveDependents(child).isEmpty());
                    }
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
