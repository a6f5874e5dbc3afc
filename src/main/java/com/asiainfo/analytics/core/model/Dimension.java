package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 维度定义（注册后不可变）
 */
@RegisterForReflection
public record Dimension(
        String id, // 维度ID，如 time、tenant
        String name,
        DimensionType type,
        List<String> hierarchy, // 层级，由粗到细，如 [year, quarter, month, week, day]
        int cardinality,
        List<ValueFrequency> distribution // 已知取值分布，可为空
) {

    public Dimension {
        hierarchy = hierarchy == null ? List.of() : List.copyOf(hierarchy);
        distribution = distribution == null ? List.of() : List.copyOf(distribution);
    }

    /**
     * 维度取值及其出现频率（百分比）
     */
    @RegisterForReflection
    public record ValueFrequency(String value, String label, double frequency) {
    }
}
