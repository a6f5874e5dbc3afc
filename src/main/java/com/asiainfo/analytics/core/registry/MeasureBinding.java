package com.asiainfo.analytics.core.registry;

import com.asiainfo.analytics.core.model.AggregationKind;

/**
 * 度量到聚合表达式的绑定
 */
public record MeasureBinding(String id, AggregationKind kind, String column) {

    public String expression() {
        return kind.wrap(column);
    }
}
