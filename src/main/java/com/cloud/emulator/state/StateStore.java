package com.cloud.emulator.state;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Key-value store holding the records of every emulated resource.
 * Values are copied in and out, so callers never share instances with the store.
 */
public interface StateStore {

    boolean exists(String key);

    /**
     * Reads a record.
     *
     * @return the record, or empty if the key is absent
     * @throws StateStoreException if the stored value cannot be read as {@code type}
     */
    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value);

    /**
     * Deletes a record.
     *
     * @throws StateStoreException if the key is absent
     */
    void delete(String key);

    /**
     * Returns every key starting with {@code prefix}, sorted.
     */
    List<String> list(String prefix);

    /**
     * Atomically reads a record, applies {@code mutator} to it and writes it back.
     * If the mutator throws, the stored record is left unchanged.
     *
     * @return the updated record
     * @throws StateStoreException if the key is absent
     */
    <T> T update(String key, Class<T> type, Consumer<T> mutator);

    /**
     * Atomically replaces the record under {@code key} with the result of {@code remapping},
     * which receives the current record or {@code null} when the key is absent. Returning
     * {@code null} removes the key. If {@code remapping} throws, the stored record is left
     * unchanged and the exception propagates.
     *
     * @return the new record, or empty if the key is now absent
     */
    <T> Optional<T> compute(String key, Class<T> type, UnaryOperator<T> remapping);
}
