package com.cloud.emulator.metrics;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link GraphMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code resource.graph.registered}: counter (tag: resourceType)</li>
 *   <li>{@code resource.graph.unregistered}: counter (tag: resourceType)</li>
 *   <li>{@code resource.graph.relationship.added}: counter (tag: kind)</li>
 *   <li>{@code resource.graph.relationship.rejected}: counter (tags: kind, reason)</li>
 *   <li>{@code resource.graph.delete.blocked}: counter (tag: resourceType)</li>
 * </ul>
 */
public class MicrometerGraphMetrics implements GraphMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerGraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementRegistered(ResourceId id) {
        counter("resource.graph.registered", "Number of resources registered in the graph",
                "resourceType", id.typeKey()).increment();
    }

    @Override
    public void incrementUnregistered(ResourceId id) {
        counter("resource.graph.unregistered", "Number of resources removed from the graph",
                "resourceType", id.typeKey()).increment();
    }

    @Override
    public void incrementRelationshipAdded(RelationshipKind kind) {
        counter("resource.graph.relationship.added", "Number of relationships added",
                "kind", kind.name()).increment();
    }

    @Override
    public void incrementRelationshipRejected(RelationshipKind kind, ErrorKind reason) {
        String key = "resource.graph.relationship.rejected:" + kind.name() + ":" + reason.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("resource.graph.relationship.rejected")
                        .description("Number of relationships rejected by the graph")
                        .tag("kind", kind.name())
                        .tag("reason", reason.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementDeleteBlocked(ResourceId id) {
        counter("resource.graph.delete.blocked", "Number of unregister calls blocked by dependents",
                "resourceType", id.typeKey()).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
