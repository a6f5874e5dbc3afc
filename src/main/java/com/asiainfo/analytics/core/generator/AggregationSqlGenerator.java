package com.asiainfo.analytics.core.generator;

import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.SqlRequest;
import com.asiainfo.analytics.core.registry.DimensionBinding;
import com.asiainfo.analytics.core.registry.FieldRegistry;
import com.asiainfo.analytics.core.registry.FilterBinding;
import com.asiainfo.analytics.core.registry.MeasureBinding;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 聚合 SQL 生成器（SQLite 方言）
 * 结构：支付事实表关联订单、用户、租户，按维度分组，所有取值均以参数绑定
 */
@ApplicationScoped
public class AggregationSqlGenerator {

    private static final Logger log = LoggerFactory.getLogger(AggregationSqlGenerator.class);

    /** 数据库中 created_at 的存储格式（UTC） */
    public static final DateTimeFormatter DB_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public static final String RECORD_COUNT_COLUMN = "record_count";

    private static final String FROM_CLAUSE = """
            FROM payments p
            JOIN orders o ON p.order_id = o.id
            JOIN users u ON o.user_id = u.id
            JOIN tenants t ON u.tenant_id = t.id""";

    private final FieldRegistry registry;

    @Inject
    public AggregationSqlGenerator(FieldRegistry registry) {
        this.registry = registry;
    }

    /**
     * 生成聚合 SQL
     *
     * @param request  已校验的请求
     * @param rowLimit LIMIT 值，调用方传入 maxRows + 1 以判断截断
     */
    public SqlRequest generate(AggregationRequest request, int rowLimit) {
        List<Object> params = new ArrayList<>();
        List<String> selectParts = new ArrayList<>();
        List<String> groupParts = new ArrayList<>();
        List<String> orderParts = new ArrayList<>();

        // 1. 维度
        for (String dimId : request.dimensions()) {
            DimensionBinding binding = registry.dimension(dimId)
                    .orElseThrow(() -> new ValidationException("dimensions", "Unknown dimension: " + dimId));
            String expr = binding.selectExpression(request.timeGranularity());
            selectParts.add(expr + " AS " + quote(dimId));
            groupParts.addAll(binding.groupExpressions(request.timeGranularity()));
            orderParts.add(expr);
        }

        // 2. 度量
        for (String measureId : request.measures()) {
            MeasureBinding binding = registry.measure(measureId)
                    .orElseThrow(() -> new ValidationException("measures", "Unknown measure: " + measureId));
            selectParts.add(binding.expression() + " AS " + quote(measureId));
        }
        selectParts.add("COUNT(*) AS " + RECORD_COUNT_COLUMN);

        // 3. 条件
        StringBuilder where = new StringBuilder();
        where.append("WHERE ").append(FieldRegistry.TIME_COLUMN).append(" >= ?")
                .append(" AND ").append(FieldRegistry.TIME_COLUMN).append(" < ?")
                .append(" AND p.status = 'completed'");
        params.add(formatTime(request.dateRange().start()));
        params.add(formatTime(request.dateRange().end()));

        for (Map.Entry<String, Object> entry : request.filters().entrySet()) {
            FilterBinding binding = registry.filter(entry.getKey()).orElse(null);
            if (binding == null) {
                log.debug("Ignoring unsupported filter: {}", entry.getKey());
                continue;
            }
            if (entry.getValue() == null) {
                log.debug("Ignoring filter with null value: {}", entry.getKey());
                continue;
            }
            where.append(" AND ").append(binding.predicate());
            params.add(binding.numeric() ? toNumber(entry.getKey(), entry.getValue()) : entry.getValue());
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(",\n  ", selectParts)).append("\n");
        sql.append(FROM_CLAUSE).append("\n");
        sql.append(where).append("\n");
        if (!groupParts.isEmpty()) {
            sql.append("GROUP BY ").append(String.join(", ", groupParts)).append("\n");
            sql.append("ORDER BY ").append(String.join(", ", orderParts)).append("\n");
        }
        sql.append("LIMIT ?");
        params.add(rowLimit);

        return new SqlRequest(sql.toString(), params);
    }

    public static String formatTime(Instant instant) {
        return DB_TIME_FORMAT.format(instant);
    }

    private static String quote(String alias) {
        return "\"" + alias + "\"";
    }

    private static Double toNumber(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("filters." + key, "Must be numeric: " + value);
        }
    }
}
