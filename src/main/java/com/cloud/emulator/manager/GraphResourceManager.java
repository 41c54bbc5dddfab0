package com.cloud.emulator.manager;

import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.dependency.DeletionCheck;
import com.cloud.emulator.dependency.DependencyEvaluator;
import com.cloud.emulator.graph.DependencyViolationException;
import com.cloud.emulator.graph.GraphConfig;
import com.cloud.emulator.graph.RelationshipGraph;
import com.cloud.emulator.graph.ResourceGraphException;
import com.cloud.emulator.logging.LogContext;
import com.cloud.emulator.metrics.GraphMetrics;
import com.cloud.emulator.metrics.NoOpGraphMetrics;
import com.cloud.emulator.schema.ProviderSchema;
import com.cloud.emulator.schema.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link ResourceManager} backed by a {@link RelationshipGraph}.
 *
 * <p>A single {@link ReentrantReadWriteLock} guards the graph: mutations take the
 * write lock and queries the read lock. {@link #unregisterResource} evaluates
 * deletability and removes the node under one write lock, so no mutation can
 * slip in between the check and the removal.</p>
 */
public class GraphResourceManager implements ResourceManager {
    private static final Logger log = LoggerFactory.getLogger(GraphResourceManager.class);

    private final ResourceManagerConfig config;
    private final RelationshipGraph graph;
    private final DependencyEvaluator evaluator;
    private final GraphMetrics metrics;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private GraphResourceManager(Builder builder) {
        this.config = builder.config;
        SchemaValidator validator = builder.schemaValidator != null
                ? builder.schemaValidator
                : config.useProviderSchema() ? ProviderSchema.create() : SchemaValidator.permissive();
        this.graph = new RelationshipGraph(new GraphConfig(config.detectCycles(), validator));
        this.evaluator = new DependencyEvaluator();
        this.metrics = builder.metrics;
    }

    public ResourceManagerConfig getConfig() {
        return config;
    }

    @Override
    public void registerResource(ResourceId id, Map<String, String> metadata) {
        try (LogContext ctx = LogContext.forResource("register", id)) {
            mutate(() -> graph.addNode(id, metadata));
            metrics.incrementRegistered(id);
            log.debug("Registered resource {}", id);
        }
    }

    @Override
    public void unregisterResource(ResourceId id) {
        try (LogContext ctx = LogContext.forResource("unregister", id)) {
            DeletionCheck check = write(() -> {
                DeletionCheck result = evaluator.evaluate(graph, id);
                if (result.deletable()) {
                    graph.removeNode(id);
                }
                return result;
            });
            if (!check.deletable()) {
                metrics.incrementDeleteBlocked(id);
                log.debug("Unregister of {} blocked by {}", id, check.blockers());
                throw new DependencyViolationException(id, check.blockers());
            }
            metrics.incrementUnregistered(id);
            log.debug("Unregistered resource {}", id);
        }
    }

    @Override
    public void addRelationship(ResourceId from, ResourceId to, RelationshipKind kind) {
        try (LogContext ctx = LogContext.forRelationship("add-relationship", from, to, kind)) {
            try {
                mutate(() -> graph.addEdge(from, to, kind));
            } catch (ResourceGraphException e) {
                metrics.incrementRelationshipRejected(kind, e.kind());
                log.debug("Rejected relationship {} -[{}]-> {}: {}", from, kind.getLabel(), to, e.getMessage());
                throw e;
            }
            metrics.incrementRelationshipAdded(kind);
        }
    }

    @Override
    public void removeRelationship(ResourceId from, ResourceId to, RelationshipKind kind) {
        try (LogContext ctx = LogContext.forRelationship("remove-relationship", from, to, kind)) {
            mutate(() -> graph.removeEdge(from, to, kind));
        }
    }

    @Override
    public DeletionCheck canDelete(ResourceId id) {
        return read(() -> evaluator.evaluate(graph, id));
    }

    @Override
    public boolean isStrictMode() {
        return config.strictValidation();
    }

    @Override
    public boolean hasResource(ResourceId id) {
        return read(() -> graph.hasNode(id));
    }

    @Override
    public Optional<Node> getResource(ResourceId id) {
        return read(() -> graph.getNode(id));
    }

    @Override
    public List<ResourceId> transitiveDependents(ResourceId id) {
        return read(() -> graph.transitiveDependents(id));
    }

    @Override
    public List<ResourceId> transitiveDependencies(ResourceId id) {
        return read(() -> graph.transitiveDependencies(id));
    }

    @Override
    public int resourceCount() {
        return read(graph::nodeCount);
    }

    @Override
    public int relationshipCount() {
        return read(graph::edgeCount);
    }

    private <T> T read(Supplier<T> query) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return query.get();
        } finally {
            readLock.unlock();
        }
    }

    private <T> T write(Supplier<T> mutation) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return mutation.get();
        } finally {
            writeLock.unlock();
        }
    }

    private void mutate(Runnable mutation) {
        write(() -> {
            mutation.run();
            return null;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResourceManagerConfig config = ResourceManagerConfig.defaults();
        private SchemaValidator schemaValidator;
        private GraphMetrics metrics = new NoOpGraphMetrics();
        private final List<TopologySeed> seeds = new ArrayList<>();

        public Builder config(ResourceManagerConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        /**
         * Overrides the schema selected by {@link ResourceManagerConfig#useProviderSchema()}.
         */
        public Builder schemaValidator(SchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        public Builder metrics(GraphMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder seed(TopologySeed seed) {
            this.seeds.add(Objects.requireNonNull(seed, "seed is required"));
            return this;
        }

        /**
         * Builds the manager and applies the seeds in the order they were added.
         * A seed that fails propagates its exception.
         */
        public GraphResourceManager build() {
            GraphResourceManager manager = new GraphResourceManager(this);
            for (TopologySeed seed : seeds) {
                seed.seed(manager);
            }
            log.info("Resource manager ready (strict={}, detectCycles={}, schema={}, resources={})",
                    config.strictValidation(), config.detectCycles(),
                    schemaValidator != null ? "custom" : config.useProviderSchema() ? "provider" : "none",
                    manager.resourceCount());
            return manager;
        }
    }
}
