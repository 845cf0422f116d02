package io.seriesfetch.cache;

import java.util.Optional;

/**
 * Minimal key/value storage behind {@link CacheStore}. Implementations store entries as given;
 * freshness is decided by the store at read time.
 */
public interface CacheBackend<V> {
    Optional<CacheEntry<V>> get(String key);

    void put(String key, CacheEntry<V> entry);

    void remove(String key);

    /** Removes the entry only if it is still {@code expected}; returns whether it was removed. */
    boolean remove(String key, CacheEntry<V> expected);

    void clear();
}
