package com.asiainfo.analytics.infra.cache;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.AggregationResult;
import com.asiainfo.analytics.infra.cache.l1.L1CaffeineCache;
import com.asiainfo.analytics.infra.cache.l2.DistributedCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 统一缓存管理器
 * 查询顺序 L1 -> L2，L2 命中回填 L1；L2 的任何异常都按未命中处理，不影响请求
 */
@ApplicationScoped
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final CacheConfig config;
    private final L1CaffeineCache l1Cache;
    private final DistributedCache l2Cache;
    private final ObjectMapper objectMapper;
    private final Executor l2WriteExecutor;
    private final MeterRegistry registry;

    private final AtomicLong l2Hits = new AtomicLong();
    private final AtomicLong l2Misses = new AtomicLong();
    private final AtomicLong l2Errors = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    @Inject
    public CacheManager(CacheConfig config,
                        L1CaffeineCache l1Cache,
                        DistributedCache l2Cache,
                        ObjectMapper objectMapper,
                        @Named("cacheWriteExecutor") Executor l2WriteExecutor,
                        MeterRegistry registry) {
        this.config = config;
        this.l1Cache = l1Cache;
        this.l2Cache = l2Cache;
        this.objectMapper = objectMapper;
        this.l2WriteExecutor = l2WriteExecutor;
        this.registry = registry;
    }

    /**
     * 查询缓存（自动降级：L1 -> L2 -> empty）
     */
    public Optional<AggregationResult> get(AggregationRequest req) {
        CacheKey key = CacheKey.forRequest(req);
        String k = key.toL1Key();

        // L1
        if (config.isL1Enabled()) {
            Optional<CacheEntry> entry = l1Cache.get(k);
            if (entry.isPresent()) {
                count("l1", "hit");
                return Optional.of(entry.get().getPayload());
            }
            count("l1", "miss");
        }

        // L2
        if (config.isL2Enabled()) {
            AggregationResult result = readL2(key);
            if (result != null) {
                log.debug("[Cache] L2 hit: {}", key);
                // 回填L1
                if (config.isL1Enabled()) {
                    l1Cache.put(k, result);
                }
                return Optional.of(result);
            }
        }

        log.debug("[Cache] Miss: {}", key);
        return Optional.empty();
    }

    private AggregationResult readL2(CacheKey key) {
        try {
            Optional<String> json = l2Cache.get(key.toL2Key());
            if (json.isEmpty()) {
                l2Misses.incrementAndGet();
                count("l2", "miss");
                return null;
            }
            AggregationResult result = objectMapper.readValue(json.get(), AggregationResult.class);
            l2Hits.incrementAndGet();
            count("l2", "hit");
            return result;
        } catch (Exception e) {
            l2Errors.incrementAndGet();
            count("l2", "error");
            log.warn("[Cache] L2 get failed for key {}: {}", key, e.getMessage());
            return null;
        }
    }

    /**
     * 写入缓存：L1 同步写入，L2 异步写入且失败只记录日志
     */
    public void put(AggregationRequest req, AggregationResult value) {
        CacheKey key = CacheKey.forRequest(req);

        if (config.isL1Enabled()) {
            l1Cache.put(key.toL1Key(), value);
        }
        if (config.isL2Enabled()) {
            try {
                l2WriteExecutor.execute(() -> writeL2(key, value));
            } catch (Exception e) {
                log.warn("[Cache] L2 write rejected for key {}: {}", key, e.getMessage());
            }
        }
    }

    private void writeL2(CacheKey key, AggregationResult value) {
        try {
            String json = objectMapper.writeValueAsString(value);
            l2Cache.set(key.toL2Key(), json, config.getL2TtlMinutes() * 60L);
        } catch (Exception e) {
            l2Errors.incrementAndGet();
            log.warn("[Cache] L2 put failed for key {}: {}", key, e.getMessage());
        }
    }

    /**
     * 查看 L1 条目（不计入访问次数）
     */
    public Optional<CacheEntry> peek(AggregationRequest req) {
        return l1Cache.peek(CacheKey.forRequest(req).toL1Key());
    }

    /**
     * 定时清理：过期条目 + 超出容量的低频条目
     */
    public int sweep() {
        if (!config.isL1Enabled()) {
            return 0;
        }
        int evicted = l1Cache.sweep();
        evictions.addAndGet(evicted);
        return evicted;
    }

    /**
     * 停机时清空 L1，L2 由 TTL 自行过期
     */
    public void shutdown() {
        l1Cache.invalidateAll();
        log.info("[Cache] Shutdown, L1 cleared");
    }

    /**
     * 获取缓存统计信息
     */
    public CacheStats getStats() {
        var l1 = l1Cache.stats();
        return new CacheStats(
                config.isL1Enabled(),
                config.isL2Enabled(),
                l1Cache.size(),
                l1.hitCount(),
                l1.missCount(),
                l1.hitRate(),
                l2Hits.get(),
                l2Misses.get(),
                l2Errors.get(),
                evictions.get());
    }

    private void count(String tier, String result) {
        registry.counter("bi.cache.requests", "tier", tier, "result", result).increment();
    }
}
