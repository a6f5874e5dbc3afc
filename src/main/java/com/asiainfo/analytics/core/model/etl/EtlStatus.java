package com.asiainfo.analytics.core.model.etl;

public enum EtlStatus {
    RUNNING,
    SUCCESS,
    WARNING,
    FAILED
}
