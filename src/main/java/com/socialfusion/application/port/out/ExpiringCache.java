package com.socialfusion.application.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store whose entries expire after a per-entry TTL.
 * An entry is never returned once its expiry has passed. All operations are safe for
 * concurrent use and do not block on I/O.
 */
public interface ExpiringCache<K, V> {

    /**
     * Returns the live value for the key, or empty if missing or expired.
     */
    Optional<V> get(K key);

    /**
     * Stores the value, replacing any previous entry for the key.
     *
     * @throws IllegalArgumentException if ttl is zero, negative or null
     */
    void put(K key, V value, Duration ttl);

    void invalidate(K key);

    /**
     * @return number of entries removed
     */
    int invalidateAll();

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    int size();

    String name();
}
