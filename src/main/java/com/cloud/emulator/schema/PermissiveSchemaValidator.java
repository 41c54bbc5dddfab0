package com.cloud.emulator.schema;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;

import java.util.Optional;

/**
 * Schema validator used when schema validation is disabled. Accepts everything.
 */
final class PermissiveSchemaValidator implements SchemaValidator {

    static final PermissiveSchemaValidator INSTANCE = new PermissiveSchemaValidator();

    private PermissiveSchemaValidator() {
    }

    @Override
    public Optional<SchemaEntry> validate(ResourceId from, ResourceId to, RelationshipKind kind) {
        return Optional.empty();
    }
}
