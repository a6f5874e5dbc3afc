package com.asiainfo.analytics.infra.cache.l2;

import java.util.Optional;

/**
 * 跨实例共享的分布式缓存
 * 实现可以抛出异常，由 CacheManager 统一降级为未命中
 */
public interface DistributedCache {

    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);
}
