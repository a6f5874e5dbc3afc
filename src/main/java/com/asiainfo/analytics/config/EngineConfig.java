package com.asiainfo.analytics.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 聚合引擎配置
 */
@ApplicationScoped
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @ConfigProperty(name = "bi.engine.critical.deadline-ms", defaultValue = "450")
    long criticalDeadlineMs;

    @ConfigProperty(name = "bi.engine.critical.measures", defaultValue = "revenue,orders")
    List<String> criticalMeasures;

    @ConfigProperty(name = "bi.engine.critical.dimensions", defaultValue = "time,tenant")
    List<String> criticalDimensions;

    @ConfigProperty(name = "bi.engine.critical.max-dimensions", defaultValue = "2")
    int criticalMaxDimensions;

    @ConfigProperty(name = "bi.engine.critical.max-measures", defaultValue = "3")
    int criticalMaxMeasures;

    @ConfigProperty(name = "bi.engine.max-rows", defaultValue = "1000")
    int maxRows;

    @ConfigProperty(name = "bi.engine.trend.slope-threshold", defaultValue = "0.1")
    double trendSlopeThreshold;

    @ConfigProperty(name = "bi.engine.worker-threads", defaultValue = "8")
    int workerThreads;

    public static EngineConfig of(long criticalDeadlineMs, List<String> criticalMeasures,
                                  List<String> criticalDimensions, int maxRows, double trendSlopeThreshold) {
        EngineConfig config = new EngineConfig();
        config.criticalDeadlineMs = criticalDeadlineMs;
        config.criticalMeasures = List.copyOf(criticalMeasures);
        config.criticalDimensions = List.copyOf(criticalDimensions);
        config.criticalMaxDimensions = 2;
        config.criticalMaxMeasures = 3;
        config.maxRows = maxRows;
        config.trendSlopeThreshold = trendSlopeThreshold;
        config.workerThreads = 4;
        return config;
    }

    public static EngineConfig defaults() {
        return of(450, List.of("revenue", "orders"), List.of("time", "tenant"), 1000, 0.1);
    }

    /**
     * 复制当前配置并替换截止时间
     */
    public EngineConfig withCriticalDeadlineMs(long deadlineMs) {
        EngineConfig copy = of(deadlineMs, criticalMeasures, criticalDimensions, maxRows, trendSlopeThreshold);
        copy.criticalMaxDimensions = criticalMaxDimensions;
        copy.criticalMaxMeasures = criticalMaxMeasures;
        copy.workerThreads = workerThreads;
        return copy;
    }

    @PostConstruct
    void init() {
        log.info("[Engine] critical path: deadline={}ms, measures={}, dimensions={}, maxDims={}, maxMeasures={}",
                criticalDeadlineMs, criticalMeasures, criticalDimensions, criticalMaxDimensions, criticalMaxMeasures);
        log.info("[Engine] maxRows={}, trendSlopeThreshold={}, workerThreads={}",
                maxRows, trendSlopeThreshold, workerThreads);
    }

    public long getCriticalDeadlineMs() {
        return criticalDeadlineMs;
    }

    public List<String> getCriticalMeasures() {
        return criticalMeasures;
    }

    public List<String> getCriticalDimensions() {
        return criticalDimensions;
    }

    public int getCriticalMaxDimensions() {
        return criticalMaxDimensions;
    }

    public int getCriticalMaxMeasures() {
        return criticalMaxMeasures;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public double getTrendSlopeThreshold() {
        return trendSlopeThreshold;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }
}
