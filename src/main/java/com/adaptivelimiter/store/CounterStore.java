package com.adaptivelimiter.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared key-value store holding limiter state.
 * Implementations must be thread-safe; failures surface as {@link StoreUnavailableException}.
 */
public interface CounterStore {

    /**
     * Run one algorithm step atomically with respect to every other call touching the same keys.
     *
     * @param script the step to run
     * @param keys   keys the step reads and writes
     * @param args   script arguments, already rendered as strings
     * @return integer results, in the order documented on {@link CounterScript}
     */
    List<Long> execute(CounterScript script, List<String> keys, List<String> args);

    /**
     * Read a hash-shaped value.
     *
     * @return the fields, empty when the key is absent or expired
     */
    Map<String, String> getHash(String key);

    /**
     * Merge fields into a hash and reset its expiry.
     */
    void putHash(String key, Map<String, String> fields, Duration ttl);

    /**
     * Read a scalar value.
     *
     * @return the value, empty when the key is absent or expired
     */
    Optional<String> get(String key);

    /**
     * Set a scalar value with expiry.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Delete a single key; absent keys are ignored.
     */
    void delete(String key);

    /**
     * Delete every key starting with the prefix.
     *
     * @return number of keys removed
     */
    long deleteByPrefix(String prefix);

    /**
     * Round-trip check against the store.
     *
     * @return measured latency
     */
    Duration ping();
}
