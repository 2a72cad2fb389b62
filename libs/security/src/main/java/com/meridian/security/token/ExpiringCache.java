package com.meridian.security.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Time- and size-bounded cache with single-flight loading.
 * <p>
 * Concurrent misses on the same key share one load: the first caller runs the loader on
 * its own thread, later callers wait for its result for at most {@code waitTimeout}.
 * Failed loads are never cached. When the number of entries exceeds the capacity,
 * expired entries are dropped first, then the oldest completed ones.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ExpiringCache<K, V> {

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int capacity;
    private final Duration waitTimeout;
    private final Clock clock;

    /**
     * @param ttl         how long a loaded value stays fresh
     * @param capacity    maximum number of entries kept
     * @param waitTimeout how long a caller waits for another caller's in-flight load
     * @param clock       time source
     */
    public ExpiringCache(Duration ttl, int capacity, Duration waitTimeout, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (waitTimeout == null || waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("waitTimeout must be positive");
        }
        this.ttl = ttl;
        this.capacity = capacity;
        this.waitTimeout = waitTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Returns the cached value for {@code key}, loading it if absent or expired.
     *
     * @param key    cache key
     * @param loader computes the value on a miss; exceptions propagate to every waiter
     * @return the cached or freshly loaded value
     * @throws IllegalStateException if waiting for another caller's load times out or is interrupted
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        Entry<V> candidate = new Entry<>(new CompletableFuture<>(), clock.instant());
        Entry<V> entry = entries.compute(key,
                (k, existing) -> existing != null && isLive(existing) ? existing : candidate);

        if (entry != candidate) {
            return await(entry.future());
        }

        evictIfOverCapacity();
        try {
            V value = loader.apply(key);
            candidate.future().complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            entries.remove(key, candidate);
            candidate.future().completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Returns the instant the value for {@code key} started loading, if present.
     */
    public Optional<Instant> loadedAt(K key) {
        return Optional.ofNullable(entries.get(key)).map(Entry::loadedAt);
    }

    /**
     * Removes the entry for {@code key} only if it has finished loading and is at least
     * {@code minAge} old.
     *
     * @return true if an entry was removed
     */
    public boolean invalidateIfOlderThan(K key, Duration minAge) {
        Entry<V> entry = entries.get(key);
        if (entry == null || !entry.future().isDone()) {
            return false;
        }
        if (entry.loadedAt().plus(minAge).isAfter(clock.instant())) {
            return false;
        }
        return entries.remove(key, entry);
    }

    /** Current number of entries, including in-flight loads. */
    public int size() {
        return entries.size();
    }

    private boolean isLive(Entry<V> entry) {
        CompletableFuture<V> future = entry.future();
        if (!future.isDone()) {
            return true;
        }
        return !future.isCompletedExceptionally()
                && entry.loadedAt().plus(ttl).isAfter(clock.instant());
    }

    private void evictIfOverCapacity() {
        if (entries.size() <= capacity) {
            return;
        }
        entries.entrySet().removeIf(e -> e.getValue().future().isDone() && !isLive(e.getValue()));
        while (entries.size() > capacity) {
            Optional<Map.Entry<K, Entry<V>>> oldest = entries.entrySet().stream()
                    .filter(e -> e.getValue().future().isDone())
                    .min(Comparator.comparing(e -> e.getValue().loadedAt()));
            if (oldest.isEmpty()) {
                return;
            }
            entries.remove(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Cache load failed", cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out waiting for in-flight cache load", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for in-flight cache load", e);
        }
    }

    private record Entry<V>(CompletableFuture<V> future, Instant loadedAt) {
    }
}
