package com.socialfusion.domain.model;

import java.time.Instant;

/**
 * A cached value and the instant from which it must no longer be served.
 */
public record CacheEntry<T>(T value, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
