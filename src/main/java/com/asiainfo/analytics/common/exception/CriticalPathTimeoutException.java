package com.asiainfo.analytics.common.exception;

/**
 * 关键路径请求超过截止时间
 * 与一般失败区分，调用方可缩小请求后自行重试，引擎不会自动重试
 */
public class CriticalPathTimeoutException extends RuntimeException {

    private final long deadlineMs;

    public CriticalPathTimeoutException(long deadlineMs) {
        super("Critical aggregation exceeded deadline of " + deadlineMs + "ms");
        this.deadlineMs = deadlineMs;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }
}
