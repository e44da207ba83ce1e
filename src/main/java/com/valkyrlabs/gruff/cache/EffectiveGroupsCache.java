package com.valkyrlabs.gruff.cache;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.valkyrlabs.gruff.config.GruffProperties;

/**
 * Per-user cache of effective group ids.
 *
 * <p>
 * Keys embed a global membership version counter read at lookup time, so bumping
 * the counter orphans every cached result at once. Orphaned records age out on
 * their ttl.
 * </p>
 */
@Component
public class EffectiveGroupsCache {

    public static final String KEY_PREFIX = "effective_groups:";
    public static final String VERSION_KEY = KEY_PREFIX + "version";

    protected static final Logger logger = LoggerFactory.getLogger(EffectiveGroupsCache.class);

    private static final TypeReference<LinkedHashSet<UUID>> GROUP_SET = new TypeReference<LinkedHashSet<UUID>>() {
    };

    private final GruffCache cache;
    private final Duration ttl;
    private final Duration versionTtl;

    @Autowired
    public EffectiveGroupsCache(GruffCache cache, GruffProperties properties) {
        this(cache, properties.getCache().getEffectiveGroupsTtl(), properties.getCache().getVersionCounterTtl());
    }

    public EffectiveGroupsCache(GruffCache cache, Duration ttl, Duration versionTtl) {
        this.cache = cache;
        this.ttl = ttl;
        this.versionTtl = versionTtl;
    }

    /**
     * Cached effective groups of {@code userId}, computed by {@code loader} on a miss.
     */
    public Set<UUID> get(UUID userId, Supplier<Set<UUID>> loader) {
        String key = keyFor(userId, currentVersion());
        return cache.getOrCompute(key, GROUP_SET, () -> new LinkedHashSet<>(loader.get()), ttl);
    }

    public long currentVersion() {
        return cache.getCounter(VERSION_KEY);
    }

    /**
     * Atomically bumps the membership version counter, so concurrent invalidations
     * each move to a distinct version. A failed bump is logged; stale entries then
     * live until their ttl.
     */
    public void invalidateAll() {
        try {
            long next = cache.increment(VERSION_KEY, versionTtl);
            logger.debug("Effective group cache version bumped to {}", next);
        } catch (RuntimeException e) {
            logger.warn("Failed to bump effective group cache version: {}", e.getMessage());
        }
    }

    static String keyFor(UUID userId, long version) {
        return KEY_PREFIX + userId + ":v" + version;
    }
}
