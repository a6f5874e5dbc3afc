package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 聚合请求（每次调用构造的值对象）
 */
@RegisterForReflection
public record AggregationRequest(
        List<String> dimensions, // 维度列表，如 ["time", "tenant"]
        List<String> measures, // 度量列表，如 ["revenue", "orders"]
        TimeGranularity timeGranularity,
        DateRange dateRange,
        Map<String, Object> filters, // 过滤条件，未识别的 key 会被忽略
        AggregationKind aggregationKind, // 仅回显，度量实际使用注册的聚合方式
        boolean includeComparisons,
        boolean includeForecasts // 预留，未使用
) {

    public AggregationRequest {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        measures = measures == null ? List.of() : List.copyOf(measures);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        if (timeGranularity == null) {
            timeGranularity = TimeGranularity.DAY;
        }
        if (aggregationKind == null) {
            aggregationKind = AggregationKind.SUM;
        }
    }

    /**
     * 替换时间窗口，其余条件保持不变（用于同比/环比）
     */
    public AggregationRequest withDateRange(DateRange range) {
        return new AggregationRequest(dimensions, measures, timeGranularity, range, filters,
                aggregationKind, includeComparisons, includeForecasts);
    }
}
