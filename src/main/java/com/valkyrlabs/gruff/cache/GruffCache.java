package com.valkyrlabs.gruff.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.Longs;
import com.valkyrlabs.gruff.config.GruffProperties;

/**
 * Typed cache primitives over a {@link CacheStore}.
 *
 * <p>
 * Values are wrapped in a {@link CachedRecord} stamped with the configured format
 * version. A record from another format version, a record past its ttl, or a
 * payload that no longer parses is deleted and reported as a miss.
 * </p>
 *
 * <p>
 * Store failures on read propagate. Store failures while populating the cache in
 * {@link #getOrCompute} are logged and dropped so the computed value is still
 * returned.
 * </p>
 */
@Component
public class GruffCache {

    protected static final Logger logger = LoggerFactory.getLogger(GruffCache.class);

    private final CacheStore store;
    private final Clock clock;
    private final int formatVersion;
    private final ObjectMapper mapper = new ObjectMapper();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Autowired
    public GruffCache(CacheStore store, GruffProperties properties, Clock clock) {
        this(store, properties.getCache().getFormatVersion(), clock);
    }

    public GruffCache(CacheStore store, int formatVersion, Clock clock) {
        this.store = store;
        this.formatVersion = formatVersion;
        this.clock = clock;
    }

    public <T> void set(String key, T value, Duration ttl) {
        CachedRecord record = new CachedRecord(mapper.valueToTree(value), clock.millis(), ttl.getSeconds(),
                formatVersion);
        String payload;
        try {
            payload = mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for cache key " + key + " is not serializable", e);
        }
        store.put(key, payload, ttl);
        logger.trace("cache set {} (ttl {}s)", key, ttl.getSeconds());
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, mapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, mapper.constructType(type));
    }

    private <T> Optional<T> get(String key, JavaType type) {
        String raw = store.get(key);
        if (raw == null) {
            misses.incrementAndGet();
            logger.trace("cache miss {}", key);
            return Optional.empty();
        }

        CachedRecord record;
        try {
            record = mapper.readValue(raw, CachedRecord.class);
        } catch (JsonProcessingException e) {
            logger.debug("Discarding unreadable cache record {}: {}", key, e.getOriginalMessage());
            return discard(key);
        }
        if (record.getVersion() != formatVersion) {
            logger.debug("Discarding cache record {} with format version {} (expected {})", key,
                    record.getVersion(), formatVersion);
            return discard(key);
        }
        if (record.isExpired(clock.millis())) {
            logger.trace("cache record {} expired", key);
            return discard(key);
        }

        T value;
        try {
            value = mapper.convertValue(record.getData(), type);
        } catch (IllegalArgumentException e) {
            logger.debug("Discarding cache record {} with unexpected payload shape: {}", key, e.getMessage());
            return discard(key);
        }
        hits.incrementAndGet();
        logger.trace("cache hit {}", key);
        return Optional.ofNullable(value);
    }

    public void delete(String key) {
        store.delete(key);
    }

    /**
     * Atomically bumps the counter at {@code key}. Counters are stored as plain
     * decimals, outside the record envelope.
     */
    public long increment(String key, Duration ttl) {
        long value = store.increment(key, ttl);
        logger.trace("cache counter {} -> {}", key, value);
        return value;
    }

    /**
     * Current value of a counter written by {@link #increment}; zero when absent.
     */
    public long getCounter(String key) {
        String raw = store.get(key);
        if (raw == null) {
            return 0L;
        }
        Long value = Longs.tryParse(raw);
        if (value == null) {
            logger.debug("Discarding non-numeric cache counter {}", key);
            store.delete(key);
            return 0L;
        }
        return value;
    }

    /**
     * Cache-aside read. On a miss the supplier runs and its result is written back;
     * a {@code null} result is returned but not cached.
     */
    public <T> T getOrCompute(String key, TypeReference<T> type, Supplier<T> compute, Duration ttl) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = compute.get();
        if (value != null) {
            try {
                set(key, value, ttl);
            } catch (RuntimeException e) {
                logger.warn("Failed to populate cache key {}: {}", key, e.getMessage());
            }
        }
        return value;
    }

    public CacheStatistics getStatistics() {
        return new CacheStatistics(hits.get(), misses.get());
    }

    public void resetStatistics() {
        hits.set(0);
        misses.set(0);
    }

    private <T> Optional<T> discard(String key) {
        store.delete(key);
        misses.incrementAndGet();
        return Optional.empty();
    }
}
