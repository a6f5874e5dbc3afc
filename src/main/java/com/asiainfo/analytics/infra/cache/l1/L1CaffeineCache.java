package com.asiainfo.analytics.infra.cache.l1;

import com.asiainfo.analytics.core.model.AggregationResult;
import com.asiainfo.analytics.infra.cache.CacheConfig;
import com.asiainfo.analytics.infra.cache.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * L1 Caffeine 内存缓存
 * 只按写入时间过期，容量由定时清理控制：超过上限时按访问次数从少到多淘汰
 */
@ApplicationScoped
public class L1CaffeineCache {

    private static final Logger log = LoggerFactory.getLogger(L1CaffeineCache.class);

    private final CacheConfig config;
    private final Clock clock;
    private final Cache<String, CacheEntry> cache;

    @Inject
    public L1CaffeineCache(CacheConfig config, Ticker ticker, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getL1TtlMinutes(), TimeUnit.MINUTES)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();

        log.info("[L1 Cache] Initialized with TTL={}min, MaxSize={}",
                config.getL1TtlMinutes(), config.getL1MaxSize());
    }

    /**
     * 获取缓存，命中时访问次数加 1
     */
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry != null) {
            entry.recordAccess();
            log.debug("[L1 Cache] Hit: {}", key);
            return Optional.of(entry);
        }
        log.debug("[L1 Cache] Miss: {}", key);
        return Optional.empty();
    }

    /**
     * 查看条目但不计入访问次数
     */
    public Optional<CacheEntry> peek(String key) {
        return Optional.ofNullable(cache.asMap().get(key));
    }

    /**
     * 写入缓存，同 Key 覆盖并重置访问次数
     */
    public void put(String key, AggregationResult value) {
        cache.put(key, new CacheEntry(key, value, clock.instant()));
        log.debug("[L1 Cache] Put: {}", key);
    }

    /**
     * 清理过期条目，再按访问次数淘汰到容量上限以内
     *
     * @return 因容量淘汰的条目数
     */
    public int sweep() {
        cache.cleanUp();
        int maxSize = config.getL1MaxSize();
        int overflow = (int) cache.estimatedSize() - maxSize;
        if (overflow <= 0) {
            return 0;
        }
        List<String> victims = cache.asMap().values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::getAccessCount))
                .limit(overflow)
                .map(CacheEntry::getKey)
                .collect(Collectors.toList());
        cache.invalidateAll(victims);
        cache.cleanUp();
        log.info("[L1 Cache] Swept {} least accessed entries, size now {}", victims.size(), cache.estimatedSize());
        return victims.size();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * 清空所有缓存
     */
    public void invalidateAll() {
        cache.invalidateAll();
        log.info("[L1 Cache] Invalidated all");
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
