package io.seriesfetch.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with the instant it was stored and how long it stays fresh.
 */
public record CacheEntry<V>(V data, Instant storedAt, Duration ttl) {
    public CacheEntry {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(storedAt, "storedAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    /** Fresh iff {@code now - storedAt < ttl}. */
    public boolean isFresh(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) < 0;
    }

    public Instant expiresAt() { return storedAt.plus(ttl); }
}
