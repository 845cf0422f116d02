package io.seriesfetch.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local backend. */
public class InMemoryCacheBackend<V> implements CacheBackend<V> {
    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry<V>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, CacheEntry<V> entry) {
        entries.put(key, entry);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public boolean remove(String key, CacheEntry<V> expected) {
        return entries.remove(key, expected);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    public int size() { return entries.size(); }
}
