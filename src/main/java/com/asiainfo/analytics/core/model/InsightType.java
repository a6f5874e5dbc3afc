package com.asiainfo.analytics.core.model;

public enum InsightType {
    TREND,
    ANOMALY,
    CORRELATION
}
