package com.socialfusion.adapter.out.cache;

import com.socialfusion.application.port.out.ExpiringCache;
import com.socialfusion.domain.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local expiring map. Entries are replaced on put, never mutated, and are purged
 * lazily when read after expiry or by {@link #purgeExpired()}.
 * Time comes from the injected {@link Clock} so expiry is deterministic under test.
 */
public class InMemoryExpiringCache<K, V> implements ExpiringCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExpiringCache.class);

    private final String name;
    private final Clock clock;
    private final ConcurrentMap<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public InMemoryExpiringCache(String name, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<V> get(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            // only drop the entry we saw; a concurrent put may already have replaced it
            entries.remove(key, entry);
            log.trace("Expired entry dropped: cache={}, key={}", name, key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, was " + ttl);
        }
        Instant expiresAt = clock.instant().plus(ttl);
        entries.put(key, new CacheEntry<>(value, expiresAt));
        log.trace("Entry stored: cache={}, key={}, expiresAt={}", name, key, expiresAt);
    }

    @Override
    public void invalidate(K key) {
        entries.remove(key);
    }

    @Override
    public int invalidateAll() {
        int removed = entries.size();
        entries.clear();
        return removed;
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpiredAt(now));
        return Math.max(0, before - entries.size());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public String name() {
        return name;
    }
}
