package com.asiainfo.analytics.api.dto;

import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.common.exception.ValidationException.FieldError;
import com.asiainfo.analytics.core.model.AggregationKind;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.DateRange;
import com.asiainfo.analytics.core.model.TimeGranularity;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 聚合查询请求体
 * 日期支持 ISO-8601 时间戳（2024-01-01T00:00:00Z）或日期（2024-01-01，按 UTC 零点）
 */
@RegisterForReflection
public record AggregationQuery(
        List<String> dimensions,
        List<String> measures,
        String timeGranularity, // 默认 day
        QueryDateRange dateRange,
        Map<String, Object> filters,
        String aggregationType, // 默认 sum
        Boolean includeComparisons, // 默认 true
        Boolean includeForecasts) {

    @RegisterForReflection
    public record QueryDateRange(String startDate, String endDate) {
    }

    /**
     * 转换为领域请求，格式错误按字段收集后抛出
     */
    public AggregationRequest toRequest() {
        List<FieldError> errors = new ArrayList<>();

        TimeGranularity granularity = TimeGranularity.DAY;
        if (timeGranularity != null && !timeGranularity.isBlank()) {
            granularity = TimeGranularity.fromCode(timeGranularity);
            if (granularity == null) {
                errors.add(new FieldError("timeGranularity", "Unsupported granularity: " + timeGranularity));
            }
        }

        AggregationKind kind = AggregationKind.SUM;
        if (aggregationType != null && !aggregationType.isBlank()) {
            kind = AggregationKind.fromCode(aggregationType);
            if (kind == null) {
                errors.add(new FieldError("aggregationType", "Unsupported aggregation type: " + aggregationType));
            }
        }

        DateRange range = null;
        if (dateRange == null) {
            errors.add(new FieldError("dateRange", "dateRange is required"));
        } else {
            Instant start = parseInstant("dateRange.startDate", dateRange.startDate(), errors);
            Instant end = parseInstant("dateRange.endDate", dateRange.endDate(), errors);
            if (start != null && end != null) {
                range = new DateRange(start, end);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        return new AggregationRequest(
                dimensions,
                measures,
                granularity,
                range,
                filters,
                kind,
                includeComparisons == null || includeComparisons,
                includeForecasts != null && includeForecasts);
    }

    private static Instant parseInstant(String field, String text, List<FieldError> errors) {
        if (text == null || text.isBlank()) {
            errors.add(new FieldError(field, "Date is required"));
            return null;
        }
        String value = text.trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            errors.add(new FieldError(field, "Invalid date: " + text));
            return null;
        }
    }
}
