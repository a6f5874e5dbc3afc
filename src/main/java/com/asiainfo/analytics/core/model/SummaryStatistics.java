package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Map;

/**
 * 结果集汇总统计，随 AggregationResult 一起缓存
 */
@RegisterForReflection
public record SummaryStatistics(
        long totalRecords,
        Map<String, DimensionStats> dimensions,
        Map<String, MeasureStats> measures) {

    @RegisterForReflection
    public record DimensionStats(
            int uniqueValues,
            int nullCount, // null 或 "unknown"
            List<ValueCount> distribution // 按 count 降序
    ) {
    }

    @RegisterForReflection
    public record ValueCount(Object value, int count, double percentage) {
    }

    /**
     * 度量统计，标准差为总体标准差，分位数为 floor(n*p) 下标取值（无插值）
     */
    @RegisterForReflection
    public record MeasureStats(
            double sum,
            double avg,
            double min,
            double max,
            double stdDev,
            Map<String, Double> percentiles) {
    }
}
