package com.asiainfo.analytics.infra.cache.l2;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * L2 Redis 分布式缓存
 * 存储聚合结果的 JSON 文本
 */
@ApplicationScoped
public class L2RedisCache implements DistributedCache {

    private static final Logger log = LoggerFactory.getLogger(L2RedisCache.class);

    private final RedisDataSource redis;

    @Inject
    public L2RedisCache(RedisDataSource redis) {
        this.redis = redis;
    }

    private ValueCommands<String, String> commands() {
        return redis.value(String.class);
    }

    @Override
    public Optional<String> get(String key) {
        String value = commands().get(key);
        log.debug("[L2 Cache] {}: {}", value != null ? "Hit" : "Miss", key);
        return Optional.ofNullable(value);
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        commands().setex(key, ttlSeconds, value);
        log.debug("[L2 Cache] Put: {} (ttl={}s)", key, ttlSeconds);
    }
}
