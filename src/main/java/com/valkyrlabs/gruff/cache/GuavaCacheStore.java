package com.valkyrlabs.gruff.cache;

import java.time.Duration;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.primitives.Longs;

/**
 * In-process {@link CacheStore} on a size-bounded Guava cache.
 *
 * <p>
 * Guava expires entries on a single cache-wide policy, so each value carries its
 * own deadline and is dropped on the first read past it.
 * </p>
 */
public class GuavaCacheStore implements CacheStore {

    private final Cache<String, Entry> cache;
    private final Ticker ticker;

    public GuavaCacheStore(long maximumSize, Ticker ticker) {
        this.ticker = ticker;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public String get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            cache.asMap().remove(key, entry);
            return null;
        }
        return entry.value;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Preconditions.checkNotNull(value, "Null value cannot be put in cache");
        checkTtl(ttl);
        cache.put(key, new Entry(value, ticker.read() + ttl.toNanos()));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public long increment(String key, Duration ttl) {
        checkTtl(ttl);
        Entry updated = cache.asMap().compute(key, (k, current) -> {
            long base = 0;
            if (current != null && !isExpired(current)) {
                Long parsed = Longs.tryParse(current.value);
                base = parsed == null ? 0 : parsed;
            }
            return new Entry(Long.toString(base + 1), ticker.read() + ttl.toNanos());
        });
        return Long.parseLong(updated.value);
    }

    private boolean isExpired(Entry entry) {
        return ticker.read() - entry.deadline >= 0;
    }

    private static void checkTtl(Duration ttl) {
        Preconditions.checkArgument(ttl != null && !ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    }

    long size() {
        cache.cleanUp();
        return cache.size();
    }

    private static final class Entry {
        private final String value;
        private final long deadline;

        Entry(String value, long deadline) {
            this.value = value;
            this.deadline = deadline;
        }
    }
}
