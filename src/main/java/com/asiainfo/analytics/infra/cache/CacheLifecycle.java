package com.asiainfo.analytics.infra.cache;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

/**
 * 随应用启停清理任务和 L1 缓存
 */
@ApplicationScoped
public class CacheLifecycle {

    @Inject
    CacheSweeper sweeper;

    @Inject
    CacheManager cacheManager;

    void onStart(@Observes StartupEvent ev) {
        sweeper.start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        sweeper.stop();
        cacheManager.shutdown();
    }
}
