package com.asiainfo.analytics.infra.cache;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 缓存统计快照
 */
@RegisterForReflection
public record CacheStats(
        boolean l1Enabled,
        boolean l2Enabled,
        long l1Size,
        long l1Hits,
        long l1Misses,
        double l1HitRate,
        long l2Hits,
        long l2Misses,
        long l2Errors,
        long evictions) {
}
