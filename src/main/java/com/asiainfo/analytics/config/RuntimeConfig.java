package com.asiainfo.analytics.config;

import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * 时钟与随机源
 * 测试中替换为固定实现即可控制时间和随机结果
 */
@ApplicationScoped
public class RuntimeConfig {

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    Ticker ticker() {
        return Ticker.systemTicker();
    }

    @Produces
    @Singleton
    Random random() {
        return new SecureRandom();
    }
}
