package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 度量定义（注册后不可变）
 */
@RegisterForReflection
public record Measure(
        String id, // 度量ID，如 revenue
        String name,
        NumericKind numericKind,
        AggregationKind aggregationKind,
        String unit, // 如 INR、orders
        String format, // 展示格式，如 #,##0.00
        List<String> businessRules // 业务约束，自由文本
) {

    public Measure {
        businessRules = businessRules == null ? List.of() : List.copyOf(businessRules);
    }
}
