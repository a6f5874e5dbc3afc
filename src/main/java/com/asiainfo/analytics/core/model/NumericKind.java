package com.asiainfo.analytics.core.model;

public enum NumericKind {
    INTEGER,
    DECIMAL,
    PERCENTAGE,
    CURRENCY
}
