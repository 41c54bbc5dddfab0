package com.cloud.emulator.schema;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.graph.SchemaViolationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static table of legal relationships between resource types.
 *
 * Keys have the form {@code fromService:fromType -> toService:toType}.
 * The table is immutable once built and is safe to share between threads.
 */
public final class RelationshipSchema implements SchemaValidator {

    private final Map<String, SchemaEntry> relationships;

    private RelationshipSchema(Map<String, SchemaEntry> relationships) {
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    public static String key(String fromService, String fromType, String toService, String toType) {
        return fromService + ":" + fromType + " -> " + toService + ":" + toType;
    }

    public static String key(ResourceId from, ResourceId to) {
        return from.typeKey() + " -> " + to.typeKey();
    }

    @Override
    public Optional<SchemaEntry> validate(ResourceId from, ResourceId to, RelationshipKind kind) {
        String key = key(from, to);
        SchemaEntry entry = relationships.get(key);
        if (entry == null) {
            throw new SchemaViolationException(key, "relationship not defined in schema: " + key);
        }
        if (entry.kind() != kind) {
            throw new SchemaViolationException(key,
                    "relationship kind mismatch for " + key + ": expected "
                            + entry.kind().getLabel() + ", got " + kind.getLabel());
        }
        return Optional.of(entry);
    }

    public Optional<SchemaEntry> getRelationship(String fromService, String fromType,
                                                 String toService, String toType) {
        return Optional.ofNullable(relationships.get(key(fromService, fromType, toService, toType)));
    }

    public boolean hasRelationship(String fromService, String fromType, String toService, String toType) {
        return relationships.containsKey(key(fromService, fromType, toService, toType));
    }

    /**
     * Returns all relationships where the given type is the source, keyed as in the table.
     */
    public Map<String, SchemaEntry> relationshipsForSource(String service, String type) {
        String prefix = service + ":" + type + " -> ";
        Map<String, SchemaEntry> result = new LinkedHashMap<>();
        relationships.forEach((key, entry) -> {
            if (key.startsWith(prefix)) {
                result.put(key, entry);
            }
        });
        return result;
    }

    /**
     * Returns all relationships where the given type is the target, keyed as in the table.
     */
    public Map<String, SchemaEntry> relationshipsForTarget(String service, String type) {
        String suffix = " -> " + service + ":" + type;
        Map<String, SchemaEntry> result = new LinkedHashMap<>();
        relationships.forEach((key, entry) -> {
            if (key.endsWith(suffix)) {
                result.put(key, entry);
            }
        });
        return result;
    }

    public Map<String, SchemaEntry> getRelationships() {
        return relationships;
    }

    public int size() {
        return relationships.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, SchemaEntry> relationships = new LinkedHashMap<>();

        public Builder relationship(String fromService, String fromType,
                                    String toService, String toType,
                                    RelationshipKind kind, Cardinality cardinality,
                                    String description) {
            return relationship(fromService, fromType, toService, toType,
                    new SchemaEntry(kind, cardinality, description));
        }

        public Builder relationship(String fromService, String fromType,
                                    String toService, String toType,
                                    SchemaEntry entry) {
            Objects.requireNonNull(entry, "entry is required");
            relationships.put(key(fromService, fromType, toService, toType), entry);
            return this;
        }

        public RelationshipSchema build() {
            return new RelationshipSchema(relationships);
        }
    }
}
