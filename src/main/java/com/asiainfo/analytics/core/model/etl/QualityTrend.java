package com.asiainfo.analytics.core.model.etl;

public enum QualityTrend {
    IMPROVING,
    STABLE,
    DEGRADING
}
