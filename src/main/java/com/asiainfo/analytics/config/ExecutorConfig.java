package com.asiainfo.analytics.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置
 * 关键路径与对比查询使用独立线程池，对比任务不会占用关键路径的线程
 */
@ApplicationScoped
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Produces
    @Singleton
    @Named("criticalExecutor")
    ExecutorService criticalExecutor(EngineConfig config) {
        log.info("关键路径线程池初始化，线程数: {}", config.getWorkerThreads());
        return Executors.newFixedThreadPool(config.getWorkerThreads(), namedFactory("bi-critical"));
    }

    @Produces
    @Singleton
    @Named("comparisonExecutor")
    ExecutorService comparisonExecutor(EngineConfig config) {
        return Executors.newFixedThreadPool(config.getWorkerThreads(), namedFactory("bi-comparison"));
    }

    @Produces
    @Singleton
    @Named("cacheWriteExecutor")
    Executor cacheWriteExecutor() {
        return Executors.newSingleThreadExecutor(namedFactory("bi-l2-writer"));
    }

    void closeCritical(@Disposes @Named("criticalExecutor") ExecutorService executor) {
        executor.shutdownNow();
    }

    void closeComparison(@Disposes @Named("comparisonExecutor") ExecutorService executor) {
        executor.shutdownNow();
    }

    void closeCacheWriter(@Disposes @Named("cacheWriteExecutor") Executor executor) {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    static ThreadFactory namedFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
