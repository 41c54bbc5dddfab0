package com.cloud.emulator.graph;

import com.cloud.emulator.core.model.ResourceId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a resource cannot be unregistered because other resources
 * still depend on it. Carries the blocking resources in a stable order.
 */
public class DependencyViolationException extends ResourceGraphException {

    private final ResourceId resource;
    private final List<ResourceId> blockers;

    public DependencyViolationException(ResourceId resource, List<ResourceId> blockers) {
        super(ErrorKind.DEPENDENCY_VIOLATION, formatMessage(resource, blockers));
        this.resource = resource;
        this.blockers = List.copyOf(blockers);
    }

    public ResourceId getResource() {
        return resource;
    }

    public List<ResourceId> getBlockers() {
        return blockers;
    }

    private static String formatMessage(ResourceId resource, List<ResourceId> blockers) {
        String ids = blockers.stream()
                .map(ResourceId::toString)
                .collect(Collectors.joining(", "));
        return "cannot delete " + resource + ": " + blockers.size() + " dependent(s) exist [" + ids + "]";
    }
}
