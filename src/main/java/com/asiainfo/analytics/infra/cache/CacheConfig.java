package com.asiainfo.analytics.infra.cache;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 缓存配置管理
 * 统一管理两层缓存的配置项
 */
@ApplicationScoped
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    // L1 Caffeine配置
    @ConfigProperty(name = "bi.cache.l1.enabled", defaultValue = "true")
    boolean l1Enabled;

    @ConfigProperty(name = "bi.cache.l1.ttl-minutes", defaultValue = "30")
    int l1TtlMinutes;

    @ConfigProperty(name = "bi.cache.l1.max-size", defaultValue = "100")
    int l1MaxSize;

    @ConfigProperty(name = "bi.cache.l1.sweep-interval-minutes", defaultValue = "5")
    long sweepIntervalMinutes;

    // L2 Redis配置，TTL 比 L1 短：L2 只负责跨实例共享
    @ConfigProperty(name = "bi.cache.l2.enabled", defaultValue = "true")
    boolean l2Enabled;

    @ConfigProperty(name = "bi.cache.l2.ttl-minutes", defaultValue = "15")
    int l2TtlMinutes;

    /**
     * 非 CDI 场景（单元测试、嵌入式使用）直接构造
     */
    public static CacheConfig of(boolean l1Enabled, int l1TtlMinutes, int l1MaxSize, long sweepIntervalMinutes,
                                 boolean l2Enabled, int l2TtlMinutes) {
        CacheConfig config = new CacheConfig();
        config.l1Enabled = l1Enabled;
        config.l1TtlMinutes = l1TtlMinutes;
        config.l1MaxSize = l1MaxSize;
        config.sweepIntervalMinutes = sweepIntervalMinutes;
        config.l2Enabled = l2Enabled;
        config.l2TtlMinutes = l2TtlMinutes;
        return config;
    }

    public static CacheConfig defaults() {
        return of(true, 30, 100, 5, true, 15);
    }

    @PostConstruct
    void init() {
        log.info("=== Cache Configuration ===");
        log.info("L1 (Caffeine): {} (TTL: {}min, MaxSize: {}, Sweep: {}min)",
                l1Enabled ? "ENABLED" : "DISABLED", l1TtlMinutes, l1MaxSize, sweepIntervalMinutes);
        log.info("L2 (Redis):    {} (TTL: {}min)",
                l2Enabled ? "ENABLED" : "DISABLED", l2TtlMinutes);
        log.info("===========================");
    }

    // Getters
    public boolean isL1Enabled() {
        return l1Enabled;
    }

    public int getL1TtlMinutes() {
        return l1TtlMinutes;
    }

    public int getL1MaxSize() {
        return l1MaxSize;
    }

    public long getSweepIntervalMinutes() {
        return sweepIntervalMinutes;
    }

    public boolean isL2Enabled() {
        return l2Enabled;
    }

    public int getL2TtlMinutes() {
        return l2TtlMinutes;
    }
}
