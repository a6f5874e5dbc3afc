package com.asiainfo.analytics.common.exception;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 请求校验失败（字段级）
 * 不重试，直接返回给调用方
 */
public class ValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super(errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining(", ")));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldError(field, message)));
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    @RegisterForReflection
    public record FieldError(String field, String message) {
    }
}
