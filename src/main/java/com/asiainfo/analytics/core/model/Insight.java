package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 自动洞察
 */
@RegisterForReflection
public record Insight(
        InsightType type,
        List<String> measures, // 涉及的度量，相关性洞察为两个
        String description,
        double significance, // [0, 1]
        double confidence,
        String recommendation) {

    public Insight {
        measures = measures == null ? List.of() : List.copyOf(measures);
    }
}
