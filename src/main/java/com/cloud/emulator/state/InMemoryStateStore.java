package com.cloud.emulator.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * In-memory {@link StateStore}. Values are stored as JSON so every read
 * returns a fresh copy. Thread-safe; {@link #update} and {@link #compute} are atomic per key.
 */
public class InMemoryStateStore implements StateStore {

    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryStateStore() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public boolean exists(String key) {
        return data.containsKey(key);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = data.get(key);
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(fromJson(key, json, type));
    }

    @Override
    public void set(String key, Object value) {
        data.put(key, toJson(key, value));
    }

    @Override
    public void delete(String key) {
        if (data.remove(key) == null) {
            throw new StateStoreException("key " + key + " not found");
        }
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : data.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        keys.sort(null);
        return keys;
    }

    @Override
    public <T> T update(String key, Class<T> type, Consumer<T> mutator) {
        Object[] holder = new Object[1];
        String updated = data.computeIfPresent(key, (k, json) -> {
            T value = fromJson(k, json, type);
            mutator.accept(value);
            holder[0] = value;
            return toJson(k, value);
        });
        if (updated == null) {
            throw new StateStoreException("key " + key + " not found");
        }
        return type.cast(holder[0]);
    }

    @Override
    public <T> Optional<T> compute(String key, Class<T> type, UnaryOperator<T> remapping) {
        Object[] holder = new Object[1];
        data.compute(key, (k, json) -> {
            T current = json == null ? null : fromJson(k, json, type);
            T value = remapping.apply(current);
            holder[0] = value;
            return value == null ? null : toJson(k, value);
        });
        return Optional.ofNullable(type.cast(holder[0]));
    }

    /**
     * Removes every record.
     */
    public void clear() {
        data.clear();
    }

    public int size() {
        return data.size();
    }

    private String toJson(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize value for key " + key, e);
        }
    }

    private <T> T fromJson(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to deserialize value for key " + key, e);
        }
    }
}
