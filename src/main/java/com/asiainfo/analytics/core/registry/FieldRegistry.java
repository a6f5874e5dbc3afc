package com.asiainfo.analytics.core.registry;

import com.asiainfo.analytics.core.model.AggregationKind;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 维度、度量、过滤条件注册表
 * 只有注册过的名称才能进入 SQL，调用方传入的字符串不会被拼接到语句中
 */
@ApplicationScoped
public class FieldRegistry {

    public static final String TIME_COLUMN = "p.created_at";

    private final Map<String, DimensionBinding> dimensions = new LinkedHashMap<>();
    private final Map<String, MeasureBinding> measures = new LinkedHashMap<>();
    private final Map<String, FilterBinding> filters = new LinkedHashMap<>();

    public FieldRegistry() {
        registerDimension(DimensionBinding.temporal("time", TIME_COLUMN));
        registerDimension(new DimensionBinding("tenant", "t.name", List.of("t.id", "t.name"), false));
        registerDimension(DimensionBinding.column("region", "t.region"));
        registerDimension(DimensionBinding.column("subscription_tier", "t.subscription_tier"));
        registerDimension(DimensionBinding.column("user_type", "u.role"));
        registerDimension(DimensionBinding.column("meal_type", "o.meal_type"));

        registerMeasure(new MeasureBinding("revenue", AggregationKind.SUM, "p.amount"));
        registerMeasure(new MeasureBinding("orders", AggregationKind.DISTINCT, "o.id"));
        registerMeasure(new MeasureBinding("students", AggregationKind.DISTINCT, "o.student_id"));
        registerMeasure(new MeasureBinding("transactions", AggregationKind.COUNT, "p.id"));
        registerMeasure(new MeasureBinding("avg_order_value", AggregationKind.AVG, "p.amount"));
        registerMeasure(new MeasureBinding("largest_payment", AggregationKind.MAX, "p.amount"));
        registerMeasure(new MeasureBinding("smallest_payment", AggregationKind.MIN, "p.amount"));

        registerFilter(new FilterBinding("tenantId", "t.id", "=", false));
        registerFilter(new FilterBinding("minAmount", "p.amount", ">=", true));
        registerFilter(new FilterBinding("region", "t.region", "=", false));
        registerFilter(new FilterBinding("mealType", "o.meal_type", "=", false));
    }

    private void registerDimension(DimensionBinding binding) {
        dimensions.put(binding.id(), binding);
    }

    private void registerMeasure(MeasureBinding binding) {
        measures.put(binding.id(), binding);
    }

    private void registerFilter(FilterBinding binding) {
        filters.put(binding.key(), binding);
    }

    public Optional<DimensionBinding> dimension(String id) {
        return Optional.ofNullable(dimensions.get(id));
    }

    public Optional<MeasureBinding> measure(String id) {
        return Optional.ofNullable(measures.get(id));
    }

    public Optional<FilterBinding> filter(String key) {
        return Optional.ofNullable(filters.get(key));
    }
}
