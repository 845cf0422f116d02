package io.seriesfetch.cache;

import io.seriesfetch.error.Failures;
import io.seriesfetch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * TTL cache over a pluggable backend that runs at most one fetch per key at a time.
 *
 * <p>Entries expire by comparing their age with their TTL on read; a stale entry is removed when it is read.
 * {@link #getOrFetch} registers an in-flight future per key: the first caller for a missing key runs the fetch on its
 * own thread, later callers for the same key wait on that future. A failed fetch caches nothing and every waiter sees
 * the same failure. If the running caller is interrupted, its waiters are released to try again rather than failed.
 */
public class CacheStore<V> {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(3);

    private final CacheBackend<V> backend;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Metrics metrics;
    private final ConcurrentHashMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public CacheStore(CacheBackend<V> backend, Clock clock) {
        this(backend, clock, DEFAULT_TTL, null);
    }

    public CacheStore(CacheBackend<V> backend, Clock clock, Duration defaultTtl, Metrics metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.defaultTtl = requirePositive(defaultTtl == null ? DEFAULT_TTL : defaultTtl);
        this.metrics = metrics == null ? Metrics.detached() : metrics;
    }

    public Duration defaultTtl() { return defaultTtl; }

    /** The entry for {@code key} if it is still fresh. */
    public Optional<CacheEntry<V>> get(String key) {
        Optional<CacheEntry<V>> entry = backend.get(key);
        if (entry.isEmpty()) return Optional.empty();
        if (entry.get().isFresh(clock.instant())) return entry;
        // only the entry that was read; a concurrent fetch may already have replaced it
        if (backend.remove(key, entry.get())) {
            log.debug("Cache entry {} expired at {}", key, entry.get().expiresAt());
        }
        return Optional.empty();
    }

    public void set(String key, V data, Duration ttl) {
        backend.put(key, new CacheEntry<>(data, clock.instant(), requirePositive(ttl)));
    }

    public void set(String key, V data) {
        set(key, data, defaultTtl);
    }

    public V getOrFetch(String key, Callable<V> fetch) throws InterruptedException {
        return getOrFetch(key, defaultTtl, fetch);
    }

    public V getOrFetch(String key, Duration ttl, Callable<V> fetch) throws InterruptedException {
        Objects.requireNonNull(fetch, "fetch");
        requirePositive(ttl);
        while (true) {
            Optional<CacheEntry<V>> hit = get(key);
            if (hit.isPresent()) {
                metrics.counter("cache.hits").inc();
                log.debug("Cache hit for {}", key);
                return hit.get().data();
            }

            CompletableFuture<V> mine = new CompletableFuture<>();
            CompletableFuture<V> running = inFlight.putIfAbsent(key, mine);
            if (running == null) {
                return fetchAsLeader(key, ttl, fetch, mine);
            }
            metrics.counter("cache.joins").inc();
            log.debug("Joining in-flight fetch for {}", key);
            try {
                return running.get();
            } catch (CancellationException abandoned) {
                log.debug("In-flight fetch for {} was abandoned by its caller; trying again", key);
            } catch (ExecutionException e) {
                throw Failures.propagate(e);
            }
        }
    }

    private V fetchAsLeader(String key, Duration ttl, Callable<V> fetch, CompletableFuture<V> mine)
            throws InterruptedException {
        try {
            // a fetch may have finished between the miss and the registration
            Optional<CacheEntry<V>> raced = get(key);
            if (raced.isPresent()) {
                mine.complete(raced.get().data());
                return raced.get().data();
            }
            metrics.counter("cache.misses").inc();
            log.debug("Cache miss for {}; fetching", key);
            V value = Objects.requireNonNull(fetch.call(), "fetch returned null for " + key);
            set(key, value, ttl);
            mine.complete(value);
            return value;
        } catch (InterruptedException ie) {
            // the leader was cancelled, not the fetch: waiters retry instead of failing
            inFlight.remove(key, mine);
            mine.cancel(false);
            throw ie;
        } catch (Exception e) {
            mine.completeExceptionally(e);
            throw Failures.propagate(e);
        } catch (Error err) {
            mine.completeExceptionally(err);
            throw err;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidate(String key) {
        backend.remove(key);
    }

    public void clear() {
        backend.clear();
    }

    /** Number of keys with a fetch currently running. */
    public int inFlightCount() { return inFlight.size(); }

    private static Duration requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive: " + ttl);
        return ttl;
    }
}
