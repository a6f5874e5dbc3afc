package com.asiainfo.analytics.core.model;

import java.util.Locale;

/**
 * 聚合方式，决定度量映射到的 SQL 聚合函数
 */
public enum AggregationKind {

    SUM("sum"),
    AVG("avg"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    DISTINCT("distinct");

    private final String code;

    AggregationKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AggregationKind fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AggregationKind k : values()) {
            if (k.code.equals(normalized)) {
                return k;
            }
        }
        return null;
    }

    /**
     * 包装列为聚合表达式，如 SUM(p.amount)、COUNT(DISTINCT o.id)
     */
    public String wrap(String column) {
        return switch (this) {
            case SUM -> "SUM(" + column + ")";
            case AVG -> "AVG(" + column + ")";
            case COUNT -> "COUNT(" + column + ")";
            case MIN -> "MIN(" + column + ")";
            case MAX -> "MAX(" + column + ")";
            case DISTINCT -> "COUNT(DISTINCT " + column + ")";
        };
    }
}
