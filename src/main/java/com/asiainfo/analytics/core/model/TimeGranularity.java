package com.asiainfo.analytics.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * 时间粒度
 * SQL 截断表达式与 Java 侧分桶函数必须输出相同格式，否则趋势排序和分组会错位
 */
public enum TimeGranularity {

    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year");

    private final String code;

    TimeGranularity(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 按编码解析，如 "day"
     *
     * @return 对应粒度，无法识别时返回 null
     */
    public static TimeGranularity fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (TimeGranularity g : values()) {
            if (g.code.equals(normalized)) {
                return g;
            }
        }
        return null;
    }

    /**
     * 生成 SQLite 时间截断表达式
     */
    public String sqlExpression(String column) {
        return switch (this) {
            case HOUR -> "strftime('%Y-%m-%d-%H', " + column + ")";
            case DAY -> "strftime('%Y-%m-%d', " + column + ")";
            case WEEK -> "strftime('%Y-%W', " + column + ")";
            case MONTH -> "strftime('%Y-%m', " + column + ")";
            case QUARTER -> "strftime('%Y', " + column + ") || '-Q' || ((CAST(strftime('%m', " + column
                    + ") AS INTEGER) - 1) / 3 + 1)";
            case YEAR -> "strftime('%Y', " + column + ")";
        };
    }

    /**
     * Java 侧分桶，时区固定 UTC
     * 周编号与 strftime('%W') 一致：以周一为一周开始，首个周一之前为第 00 周
     */
    public String bucket(Instant instant) {
        LocalDateTime t = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        return switch (this) {
            case HOUR -> String.format("%04d-%02d-%02d-%02d",
                    t.getYear(), t.getMonthValue(), t.getDayOfMonth(), t.getHour());
            case DAY -> String.format("%04d-%02d-%02d", t.getYear(), t.getMonthValue(), t.getDayOfMonth());
            case WEEK -> {
                int yday = t.getDayOfYear() - 1;
                int mondayBased = t.getDayOfWeek().getValue() - 1;
                yield String.format("%04d-%02d", t.getYear(), (yday + 7 - mondayBased) / 7);
            }
            case MONTH -> String.format("%04d-%02d", t.getYear(), t.getMonthValue());
            case QUARTER -> String.format("%04d-Q%d", t.getYear(), (t.getMonthValue() - 1) / 3 + 1);
            case YEAR -> String.format("%04d", t.getYear());
        };
    }
}
