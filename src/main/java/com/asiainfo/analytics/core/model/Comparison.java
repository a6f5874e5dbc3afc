package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Map;

/**
 * 同比/环比结果
 */
@RegisterForReflection
public record Comparison(PreviousPeriod previousPeriod, Benchmark benchmark) {

    @RegisterForReflection
    public record PreviousPeriod(
            DateRange window,
            Map<String, Double> currentTotal,
            Map<String, Double> previousTotal,
            Map<String, Double> change,
            Map<String, Double> changePercentage) {
    }

    /**
     * 对标数据（行业均值、目标值、偏差）
     */
    @RegisterForReflection
    public record Benchmark(
            Map<String, Double> industry,
            Map<String, Double> target,
            Map<String, Double> variance) {
    }
}
