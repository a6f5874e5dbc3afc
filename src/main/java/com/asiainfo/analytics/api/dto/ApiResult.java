package com.asiainfo.analytics.api.dto;

import com.asiainfo.analytics.common.exception.CriticalPathTimeoutException;
import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 统一返回结构
 * status: 0000 成功, 1001 参数校验失败, 1002 关键路径超时, 1004 不存在, 9999 其他失败
 */
@RegisterForReflection
public record ApiResult<T>(
        T data,
        String status, // 业务状态码
        String msg) {

    public static final String SUCCESS = "0000";
    public static final String VALIDATION_FAILED = "1001";
    public static final String CRITICAL_TIMEOUT = "1002";
    public static final String NOT_FOUND = "1004";
    public static final String FAILED = "9999";

    public static <T> ApiResult<T> success(T data, String msg) {
        return new ApiResult<>(data, SUCCESS, msg);
    }

    public static <T> ApiResult<T> error(String status, String msg) {
        return new ApiResult<>(null, status, msg);
    }

    /**
     * 按异常类型映射状态码
     */
    public static <T> ApiResult<T> fromException(Exception e) {
        if (e instanceof ValidationException) {
            return error(VALIDATION_FAILED, "参数校验失败: " + e.getMessage());
        }
        if (e instanceof CriticalPathTimeoutException) {
            return error(CRITICAL_TIMEOUT, "查询超时: " + e.getMessage());
        }
        if (e instanceof EntityNotFoundException) {
            return error(NOT_FOUND, e.getMessage());
        }
        return error(FAILED, "处理失败: " + e.getMessage());
    }
}
