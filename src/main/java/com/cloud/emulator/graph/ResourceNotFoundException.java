package com.cloud.emulator.graph;

import com.cloud.emulator.core.model.ResourceId;

/**
 * Thrown when an operation references a resource that is not registered.
 */
public class ResourceNotFoundException extends ResourceGraphException {

    private final ResourceId resource;

    public ResourceNotFoundException(ResourceId resource) {
        super(ErrorKind.NOT_FOUND, "node " + resource + " not found");
        this.resource = resource;
    }

    public ResourceId getResource() {
        return resource;
    }
}
