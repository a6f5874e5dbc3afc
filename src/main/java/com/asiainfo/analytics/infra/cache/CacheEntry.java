package com.asiainfo.analytics.infra.cache;

import com.asiainfo.analytics.core.model.AggregationResult;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * L1 缓存条目
 * accessCount 从 0 开始，每次命中加 1，容量清理时优先淘汰访问最少的条目
 */
public class CacheEntry {

    private final String key;
    private final AggregationResult payload;
    private final Instant insertedAt;
    private final AtomicLong accessCount = new AtomicLong();

    public CacheEntry(String key, AggregationResult payload, Instant insertedAt) {
        this.key = key;
        this.payload = payload;
        this.insertedAt = insertedAt;
    }

    public long recordAccess() {
        return accessCount.incrementAndGet();
    }

    public String getKey() {
        return key;
    }

    public AggregationResult getPayload() {
        return payload;
    }

    public Instant getInsertedAt() {
        return insertedAt;
    }

    public long getAccessCount() {
        return accessCount.get();
    }
}
