package com.cloud.emulator.graph;

import com.cloud.emulator.core.model.ResourceId;

/**
 * Thrown when a resource identity is registered twice.
 */
public class ResourceAlreadyExistsException extends ResourceGraphException {

    private final ResourceId resource;

    public ResourceAlreadyExistsException(ResourceId resource) {
        super(ErrorKind.ALREADY_EXISTS, "node " + resource + " already exists");
        this.resource = resource;
    }

    public ResourceId getResource() {
        return resource;
    }
}
