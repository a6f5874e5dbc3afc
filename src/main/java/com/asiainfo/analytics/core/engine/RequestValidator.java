package com.asiainfo.analytics.core.engine;

import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.common.exception.ValidationException.FieldError;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.registry.FieldRegistry;
import com.asiainfo.analytics.core.registry.FilterBinding;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 聚合请求校验，收集全部字段错误后一次性抛出
 */
@ApplicationScoped
public class RequestValidator {

    private final FieldRegistry registry;

    @Inject
    public RequestValidator(FieldRegistry registry) {
        this.registry = registry;
    }

    public void validate(AggregationRequest request) {
        List<FieldError> errors = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (String dim : request.dimensions()) {
            if (registry.dimension(dim).isEmpty()) {
                errors.add(new FieldError("dimensions", "Unknown dimension: " + dim));
            } else if (!seen.add(dim)) {
                errors.add(new FieldError("dimensions", "Duplicate dimension: " + dim));
            }
        }

        if (request.measures().isEmpty()) {
            errors.add(new FieldError("measures", "At least one measure is required"));
        }
        seen.clear();
        for (String measure : request.measures()) {
            if (registry.measure(measure).isEmpty()) {
                errors.add(new FieldError("measures", "Unknown measure: " + measure));
            } else if (!seen.add(measure)) {
                errors.add(new FieldError("measures", "Duplicate measure: " + measure));
            }
        }

        if (request.dateRange() == null || request.dateRange().start() == null
                || request.dateRange().end() == null) {
            errors.add(new FieldError("dateRange", "startDate and endDate are required"));
        } else if (!request.dateRange().start().isBefore(request.dateRange().end())) {
            errors.add(new FieldError("dateRange", "startDate must be before endDate"));
        }

        for (Map.Entry<String, Object> entry : request.filters().entrySet()) {
            FilterBinding binding = registry.filter(entry.getKey()).orElse(null);
            if (binding != null && binding.numeric() && entry.getValue() != null
                    && !isNumeric(entry.getValue())) {
                errors.add(new FieldError("filters." + entry.getKey(), "Must be numeric: " + entry.getValue()));
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        try {
            Double.parseDouble(value.toString().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
