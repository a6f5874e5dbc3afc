package com.asiainfo.analytics.core.engine;

import com.asiainfo.analytics.config.EngineConfig;
import com.asiainfo.analytics.core.generator.AggregationSqlGenerator;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.ResultRow;
import com.asiainfo.analytics.core.model.ResultRow.RowMetadata;
import com.asiainfo.analytics.core.model.SqlRequest;
import com.asiainfo.analytics.infra.persistence.AggregationDataStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * 聚合执行器：生成 SQL、查询数据源、整理为结果行
 * 在查询前后检查线程中断，超时取消后不再产生结果
 */
@ApplicationScoped
public class AggregationExecutor {

    private static final Logger log = LoggerFactory.getLogger(AggregationExecutor.class);

    static final double ROW_CONFIDENCE = 0.95;
    static final double ROW_DATA_QUALITY = 0.92;

    private final AggregationSqlGenerator sqlGenerator;
    private final AggregationDataStore dataStore;
    private final EngineConfig config;

    @Inject
    public AggregationExecutor(AggregationSqlGenerator sqlGenerator, AggregationDataStore dataStore,
                               EngineConfig config) {
        this.sqlGenerator = sqlGenerator;
        this.dataStore = dataStore;
        this.config = config;
    }

    public List<ResultRow> execute(AggregationRequest request) {
        checkInterrupted();
        int maxRows = config.getMaxRows();
        SqlRequest sql = sqlGenerator.generate(request, maxRows + 1);
        log.debug("[Engine] SQL: {} params={}", sql.sql(), sql.params());

        List<Map<String, Object>> raw = dataStore.query(sql);
        checkInterrupted();

        if (raw.size() > maxRows) {
            log.warn("[Engine] Result truncated to {} rows for dimensions={} measures={}",
                    maxRows, request.dimensions(), request.measures());
            raw = raw.subList(0, maxRows);
        }

        List<ResultRow> rows = new ArrayList<>(raw.size());
        for (Map<String, Object> record : raw) {
            long recordCount = toLong(record.get(AggregationSqlGenerator.RECORD_COUNT_COLUMN));
            // 无分组且窗口内无数据时，聚合仍返回一行计数为 0 的记录
            if (recordCount == 0) {
                continue;
            }
            Map<String, Object> dimensionValues = new LinkedHashMap<>();
            for (String dim : request.dimensions()) {
                dimensionValues.put(dim, record.get(dim));
            }
            Map<String, Double> measureValues = new LinkedHashMap<>();
            for (String measure : request.measures()) {
                measureValues.put(measure, toDouble(record.get(measure)));
            }
            rows.add(new ResultRow(dimensionValues, measureValues,
                    new RowMetadata(recordCount, ROW_CONFIDENCE, ROW_DATA_QUALITY)));
        }
        return rows;
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Aggregation cancelled");
        }
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value == null) {
            return 0.0;
        }
        return Double.parseDouble(value.toString());
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return value == null ? 0 : Long.parseLong(value.toString());
    }
}
