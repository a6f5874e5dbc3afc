package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 聚合结果行
 */
@RegisterForReflection
public record ResultRow(
        Map<String, Object> dimensionValues,
        Map<String, Double> measureValues,
        RowMetadata metadata) {

    public ResultRow {
        dimensionValues = dimensionValues == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dimensionValues));
        measureValues = measureValues == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(measureValues));
    }

    @RegisterForReflection
    public record RowMetadata(long recordCount, double confidence, double dataQuality) {
    }
}
