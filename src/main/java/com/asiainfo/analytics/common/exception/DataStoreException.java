package com.asiainfo.analytics.common.exception;

/**
 * 数据源查询失败，对当前请求是致命错误，不返回部分结果
 */
public class DataStoreException extends RuntimeException {

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
