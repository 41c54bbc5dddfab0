package com.cloud.emulator.core.model;

import java.util.Objects;

/**
 * Identity of a resource across all emulated services.
 *
 * @param service owning service, e.g. {@code ec2}, {@code iam}
 * @param type    resource type within the service, e.g. {@code vpc}, {@code role}
 * @param id      provider identifier, e.g. {@code vpc-12345} or a role name
 */
public record ResourceId(String service, String type, String id) {

    public ResourceId {
        requireText(service, "service");
        requireText(type, "type");
        requireText(id, "id");
    }

    public static ResourceId of(String service, String type, String id) {
        return new ResourceId(service, type, id);
    }

    /**
     * Returns the {@code service:type} portion used for schema lookups.
     */
    public String typeKey() {
        return service + ":" + type;
    }

    @Override
    public String toString() {
        return service + ":" + type + ":" + id;
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
