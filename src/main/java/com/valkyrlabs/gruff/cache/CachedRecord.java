package com.valkyrlabs.gruff.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope written for every cached value.
 *
 * <p>
 * {@code cachedAt} is epoch milliseconds, {@code ttl} is seconds and {@code version}
 * is the cache format version of the writer.
 * </p>
 */
public class CachedRecord {

    private final JsonNode data;
    private final long cachedAt;
    private final long ttl;
    private final int version;

    @JsonCreator
    public CachedRecord(@JsonProperty("data") JsonNode data,
            @JsonProperty("cachedAt") long cachedAt,
            @JsonProperty("ttl") long ttl,
            @JsonProperty("version") int version) {
        this.data = data;
        this.cachedAt = cachedAt;
        this.ttl = ttl;
        this.version = version;
    }

    public JsonNode getData() {
        return data;
    }

    public long getCachedAt() {
        return cachedAt;
    }

    public long getTtl() {
        return ttl;
    }

    public int getVersion() {
        return version;
    }

    boolean isExpired(long nowMillis) {
        return nowMillis - cachedAt > ttl * 1000L;
    }
}
