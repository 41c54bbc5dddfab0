package com.cloud.emulator.graph;

import com.cloud.emulator.core.model.Edge;
import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.schema.RelationshipSchema;
import com.cloud.emulator.schema.SchemaEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed graph of resources and their typed relationships, stored as
 * forward and reverse adjacency lists.
 *
 * <p>Adjacency lists keep edge insertion order, so every query returns
 * resources in a stable order for the lifetime of the graph. Each edge also
 * carries a graph-wide sequence number so edges of different kinds and
 * directions can be ordered against each other.</p>
 *
 * <p>This class is not thread-safe. {@link com.cloud.emulator.manager.GraphResourceManager}
 * owns an instance and guards every access with its lock.</p>
 */
public class RelationshipGraph {
    private static final Logger log = LoggerFactory.getLogger(RelationshipGraph.class);

    private final Map<ResourceId, Node> nodes = new LinkedHashMap<>();
    private final Map<ResourceId, List<Edge>> outEdges = new LinkedHashMap<>();
    private final Map<ResourceId, List<Edge>> inEdges = new LinkedHashMap<>();
    private final Map<Edge, Long> sequence = new HashMap<>();
    private long nextSequence;
    private final GraphConfig config;

    public RelationshipGraph() {
        this(GraphConfig.defaults());
    }

    public RelationshipGraph(GraphConfig config) {
        this.config = config;
    }

    public GraphConfig getConfig() {
        return config;
    }

    /**
     * Registers a resource.
     *
     * @throws ResourceAlreadyExistsException if the identity is already registered
     */
    public Node addNode(ResourceId id, Map<String, String> metadata) {
        if (nodes.containsKey(id)) {
            throw new ResourceAlreadyExistsException(id);
        }
        Node node = new Node(id, metadata);
        nodes.put(id, node);
        outEdges.put(id, new ArrayList<>());
        inEdges.put(id, new ArrayList<>());
        log.debug("Added node {}", id);
        return node;
    }

    /**
     * Removes a resource and every edge incident to it. Deletion policy is
     * not consulted here.
     *
     * @throws ResourceNotFoundException if the resource is not registered
     */
    public void removeNode(ResourceId id) {
        requireNode(id);
        for (Edge edge : outEdges.get(id)) {
            inEdges.get(edge.to()).removeIf(e -> e.from().equals(id));
            sequence.remove(edge);
        }
        for (Edge edge : inEdges.get(id)) {
            outEdges.get(edge.from()).removeIf(e -> e.to().equals(id));
            sequence.remove(edge);
        }
        nodes.remove(id);
        outEdges.remove(id);
        inEdges.remove(id);
        log.debug("Removed node {}", id);
    }

    public boolean hasNode(ResourceId id) {
        return nodes.containsKey(id);
    }

    public Optional<Node> getNode(ResourceId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Adds a directed edge. Adding an edge that already exists is a no-op.
     * A rejected edge leaves the graph unchanged.
     *
     * @throws ResourceNotFoundException if either endpoint is not registered
     * @throws SchemaViolationException  if the schema rejects the relationship
     * @throws CycleDetectedException    if cycle detection is on and {@code to} reaches {@code from}
     */
    public void addEdge(ResourceId from, ResourceId to, RelationshipKind kind) {
        requireNode(from);
        requireNode(to);

        Optional<SchemaEntry> schemaEntry = config.schemaValidator().validate(from, to, kind);

        if (containsEdge(from, to, kind)) {
            return;
        }

        schemaEntry.ifPresent(entry -> checkCardinality(entry, from, to, kind));

        if (config.detectCycles() && canReach(to, from)) {
            throw new CycleDetectedException(from, to, kind);
        }

        Edge edge = new Edge(from, to, kind);
        outEdges.get(from).add(edge);
        inEdges.get(to).add(edge);
        sequence.put(edge, nextSequence++);
        log.debug("Added edge {}", edge);
    }

    /**
     * Removes an edge. Missing edges and unknown endpoints are ignored.
     */
    public void removeEdge(ResourceId from, ResourceId to, RelationshipKind kind) {
        List<Edge> out = outEdges.get(from);
        List<Edge> in = inEdges.get(to);
        boolean removed = false;
        if (out != null) {
            removed = out.removeIf(e -> e.to().equals(to) && e.kind() == kind);
        }
        if (in != null) {
            in.removeIf(e -> e.from().equals(from) && e.kind() == kind);
        }
        if (removed) {
            sequence.remove(new Edge(from, to, kind));
            log.debug("Removed edge {} -[{}]-> {}", from, kind.getLabel(), to);
        }
    }

    public boolean containsEdge(ResourceId from, ResourceId to, RelationshipKind kind) {
        List<Edge> out = outEdges.get(from);
        if (out == null) {
            return false;
        }
        for (Edge e : out) {
            if (e.to().equals(to) && e.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the targets of {@code id}'s edges of the given kind, in insertion order.
     */
    public Set<ResourceId> outgoing(ResourceId id, RelationshipKind kind) {
        return collect(requireNode(id, outEdges), kind, Edge::to);
    }

    /**
     * Returns the sources of edges of the given kind that target {@code id}, in insertion order.
     */
    public Set<ResourceId> incoming(ResourceId id, RelationshipKind kind) {
        return collect(requireNode(id, inEdges), kind, Edge::from);
    }

    /**
     * Returns every edge leaving {@code id}.
     */
    public List<Edge> edgesFrom(ResourceId id) {
        return List.copyOf(requireNode(id, outEdges));
    }

    /**
     * Returns every edge arriving at {@code id}.
     */
    public List<Edge> edgesTo(ResourceId id) {
        return List.copyOf(requireNode(id, inEdges));
    }

    /**
     * Returns every edge leaving or arriving at {@code id}, in graph-wide insertion order.
     */
    public List<Edge> incidentEdges(ResourceId id) {
        Set<Edge> incident = new LinkedHashSet<>(requireNode(id, outEdges));
        incident.addAll(inEdges.get(id));
        List<Edge> ordered = new ArrayList<>(incident);
        ordered.sort(Comparator.comparingLong(sequence::get));
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Returns every resource that transitively points at {@code id}, in breadth-first order.
     */
    public List<ResourceId> transitiveDependents(ResourceId id) {
        requireNode(id);
        return breadthFirst(id, inEdges, Edge::from);
    }

    /**
     * Returns every resource {@code id} transitively points at, in breadth-first order.
     */
    public List<ResourceId> transitiveDependencies(ResourceId id) {
        requireNode(id);
        return breadthFirst(id, outEdges, Edge::to);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        int count = 0;
        for (List<Edge> edges : outEdges.values()) {
            count += edges.size();
        }
        return count;
    }

    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>();
        outEdges.values().forEach(result::addAll);
        return Collections.unmodifiableList(result);
    }

    private void checkCardinality(SchemaEntry entry, ResourceId from, ResourceId to, RelationshipKind kind) {
        String key = RelationshipSchema.key(from, to);
        if (entry.cardinality().singleTargetPerSource()) {
            for (Edge e : outEdges.get(from)) {
                if (e.kind() == kind && e.to().typeKey().equals(to.typeKey())) {
                    throw new SchemaViolationException(key,
                            "cardinality violation for " + key + " (" + entry.cardinality().getLabel() + "): "
                                    + from + " already has a linked " + to.typeKey());
                }
            }
        }
        if (entry.cardinality().singleSourcePerTarget()) {
            for (Edge e : inEdges.get(to)) {
                if (e.kind() == kind && e.from().typeKey().equals(from.typeKey())) {
                    throw new SchemaViolationException(key,
                            "cardinality violation for " + key + " (" + entry.cardinality().getLabel() + "): "
                                    + to + " is already linked from another " + from.typeKey());
                }
            }
        }
    }

    /**
     * Iterative depth-first search over edges of every kind.
     */
    private boolean canReach(ResourceId start, ResourceId target) {
        Deque<ResourceId> stack = new ArrayDeque<>();
        Set<ResourceId> visited = new HashSet<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            ResourceId current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (Edge edge : outEdges.get(current)) {
                if (!visited.contains(edge.to())) {
                    stack.push(edge.to());
                }
            }
        }
        return false;
    }

    private List<ResourceId> breadthFirst(ResourceId start, Map<ResourceId, List<Edge>> adjacency,
                                          Function<Edge, ResourceId> next) {
        Set<ResourceId> visited = new LinkedHashSet<>();
        visited.add(start);
        Deque<ResourceId> queue = new ArrayDeque<>();
        queue.add(start);
        List<ResourceId> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            ResourceId current = queue.poll();
            for (Edge edge : adjacency.get(current)) {
                ResourceId neighbour = next.apply(edge);
                if (visited.add(neighbour)) {
                    result.add(neighbour);
                    queue.add(neighbour);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static Set<ResourceId> collect(List<Edge> edges, RelationshipKind kind,
                                           Function<Edge, ResourceId> endpoint) {
        Set<ResourceId> result = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (edge.kind() == kind) {
                result.add(endpoint.apply(edge));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private void requireNode(ResourceId id) {
        if (!nodes.containsKey(id)) {
            throw new ResourceNotFoundException(id);
        }
    }

    private List<Edge> requireNode(ResourceId id, Map<ResourceId, List<Edge>> adjacency) {
        List<Edge> edges = adjacency.get(id);
        if (edges == null) {
            throw new ResourceNotFoundException(id);
        }
        return edges;
    }
}
