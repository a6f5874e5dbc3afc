package com.asiainfo.analytics.infra.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * L1 定时清理任务，单个守护线程执行
 */
@ApplicationScoped
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final CacheManager cacheManager;
    private final CacheConfig config;
    private ScheduledExecutorService scheduler;

    @Inject
    public CacheSweeper(CacheManager cacheManager, CacheConfig config) {
        this.cacheManager = cacheManager;
        this.config = config;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        long interval = config.getSweepIntervalMinutes();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bi-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runSweep, interval, interval, TimeUnit.MINUTES);
        log.info("[Cache] Sweeper started, interval {}min", interval);
    }

    void runSweep() {
        try {
            cacheManager.sweep();
        } catch (Exception e) {
            // 任务抛出异常会取消后续调度
            log.error("[Cache] Sweep failed", e);
        }
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("[Cache] Sweeper stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }
}
