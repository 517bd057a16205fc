package com.newsinsight.reliability.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Memoizes deterministic lookups in an injected Spring {@link Cache} with an explicit expiry.
 *
 * Keys are normalized (trimmed, lowercased, whitespace collapsed). Entries older than the
 * expiry are treated as absent and reloaded. Concurrent writers may overwrite each other; the
 * loaded value is the same for the same key, so the last write is as good as the first.
 * Store failures are logged and the loader result is returned uncached.
 */
@Slf4j
public class TimeAwareCache<V> {

    private final Cache store;
    private final Duration expiry;
    private final Clock clock;

    public TimeAwareCache(Cache store, Duration expiry, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.expiry = Objects.requireNonNull(expiry, "expiry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("expiry must be positive, got " + expiry);
        }
    }

    /**
     * Fresh cached value for the key, or the loader's value (cached unless null).
     */
    public V get(String key, Supplier<V> loader) {
        String normalized = normalizeKey(key);
        Optional<V> cached = lookup(normalized);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.get();
        if (value != null) {
            write(normalized, value);
        }
        return value;
    }

    public Optional<V> getIfFresh(String key) {
        return lookup(normalizeKey(key));
    }

    public void put(String key, V value) {
        Objects.requireNonNull(value, "value must not be null");
        write(normalizeKey(key), value);
    }

    public void evict(String key) {
        String normalized = normalizeKey(key);
        try {
            store.evict(normalized);
        } catch (RuntimeException e) {
            log.warn("Cache EVICT error - cache: {}, key: {}, error: {}", store.getName(), normalized, e.getMessage());
        }
    }

    public Duration getExpiry() {
        return expiry;
    }

    public static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key must not be blank");
        }
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @SuppressWarnings("unchecked")
    private Optional<V> lookup(String normalized) {
        Cache.ValueWrapper wrapper;
        try {
            wrapper = store.get(normalized);
        } catch (RuntimeException e) {
            log.warn("Cache GET error - cache: {}, key: {}, error: {}", store.getName(), normalized, e.getMessage());
            return Optional.empty();
        }
        if (wrapper == null || !(wrapper.get() instanceof CachedValue<?> entry)) {
            log.debug("Cache MISS: cache={}, key='{}'", store.getName(), normalized);
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        if (entry.writtenAt().plus(expiry).isBefore(now)) {
            log.debug("Cache STALE: cache={}, key='{}', writtenAt={}", store.getName(), normalized, entry.writtenAt());
            return Optional.empty();
        }
        log.debug("Cache HIT: cache={}, key='{}'", store.getName(), normalized);
        return Optional.ofNullable((V) entry.value());
    }

    private void write(String normalized, V value) {
        try {
            store.put(normalized, new CachedValue<>(value, Instant.now(clock)));
        } catch (RuntimeException e) {
            log.warn("Cache PUT error - cache: {}, key: {}, error: {}", store.getName(), normalized, e.getMessage());
        }
    }
}
