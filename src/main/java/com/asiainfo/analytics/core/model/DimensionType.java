package com.asiainfo.analytics.core.model;

public enum DimensionType {
    CATEGORICAL,
    NUMERICAL,
    TEMPORAL,
    GEOGRAPHICAL
}
