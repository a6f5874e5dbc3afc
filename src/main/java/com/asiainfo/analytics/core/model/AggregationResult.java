package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * 聚合结果
 * 生成后不可变，按规范化 key 缓存
 */
@RegisterForReflection
public record AggregationResult(
        String id,
        Instant generatedAt,
        AggregationRequest query,
        List<ResultRow> rows,
        SummaryStatistics summaryStatistics,
        Comparison comparisons, // 未请求对比时为 null
        List<Insight> insights) {

    public AggregationResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        insights = insights == null ? List.of() : List.copyOf(insights);
    }
}
