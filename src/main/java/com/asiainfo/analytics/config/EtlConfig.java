package com.asiainfo.analytics.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * ETL 模拟器配置
 */
@ApplicationScoped
public class EtlConfig {

    @ConfigProperty(name = "bi.etl.default-process-id", defaultValue = "revenue_etl")
    String defaultProcessId;

    // 每步模拟耗时
    @ConfigProperty(name = "bi.etl.step-delay-ms", defaultValue = "100")
    long stepDelayMs;

    @ConfigProperty(name = "bi.etl.step-records.min", defaultValue = "500")
    int minStepRecords;

    @ConfigProperty(name = "bi.etl.step-records.max", defaultValue = "1499")
    int maxStepRecords;

    // 更新记录占插入记录的比例
    @ConfigProperty(name = "bi.etl.updated-ratio", defaultValue = "0.1")
    double updatedRatio;

    @ConfigProperty(name = "bi.etl.trend.tolerance", defaultValue = "0.5")
    double trendTolerance;

    public static EtlConfig of(String defaultProcessId, long stepDelayMs, int minStepRecords, int maxStepRecords) {
        EtlConfig config = new EtlConfig();
        config.defaultProcessId = defaultProcessId;
        config.stepDelayMs = stepDelayMs;
        config.minStepRecords = minStepRecords;
        config.maxStepRecords = maxStepRecords;
        config.updatedRatio = 0.1;
        config.trendTolerance = 0.5;
        return config;
    }

    public String getDefaultProcessId() {
        return defaultProcessId;
    }

    public long getStepDelayMs() {
        return stepDelayMs;
    }

    public int getMinStepRecords() {
        return minStepRecords;
    }

    public int getMaxStepRecords() {
        return maxStepRecords;
    }

    public double getUpdatedRatio() {
        return updatedRatio;
    }

    public double getTrendTolerance() {
        return trendTolerance;
    }
}
