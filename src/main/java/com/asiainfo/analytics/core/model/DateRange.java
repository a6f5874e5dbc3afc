package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Duration;
import java.time.Instant;

/**
 * 查询时间窗口，左闭右开 [start, end)
 */
@RegisterForReflection
public record DateRange(Instant start, Instant end) {

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * 紧邻当前窗口之前、长度相同的上一窗口
     */
    public DateRange previous() {
        return new DateRange(start.minus(length()), start);
    }
}
