package com.valkyrlabs.gruff.cache;

import java.time.Duration;

/**
 * Key/value store backing {@link GruffCache}. Implementations give no ordering or
 * transactional guarantees; a failure is reported by throwing.
 */
public interface CacheStore {

    /**
     * @return the stored value, or {@code null} if absent or expired
     */
    String get(String key);

    void put(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomically adds one to the decimal counter stored at {@code key} and restarts
     * its ttl. An absent, expired or non-numeric value counts as zero.
     *
     * @return the counter after the increment
     */
    long increment(String key, Duration ttl);
}
