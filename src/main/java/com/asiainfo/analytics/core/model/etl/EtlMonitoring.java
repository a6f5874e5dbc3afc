package com.asiainfo.analytics.core.model.etl;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;

/**
 * ETL 运行监控信息
 * 不变式：recordsInserted + recordsRejected == recordsProcessed
 */
@RegisterForReflection
public record EtlMonitoring(
        String runId,
        String operation,
        String sourceType,
        String processingMode,
        EtlStatus status,
        Instant lastRun,
        double durationSeconds,
        int completedSteps,
        long recordsProcessed,
        long recordsInserted,
        long recordsUpdated,
        long recordsRejected,
        double errorRate, // 百分比
        double throughput, // records/s
        double memoryUsageMb,
        double cpuUsage) {
}
