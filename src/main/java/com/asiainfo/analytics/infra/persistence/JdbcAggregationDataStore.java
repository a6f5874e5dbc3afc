package com.asiainfo.analytics.infra.persistence;

import com.asiainfo.analytics.common.exception.DataStoreException;
import com.asiainfo.analytics.core.model.SqlRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * 基于 JDBC 的聚合数据源（默认数据源为 SQLite）
 */
@ApplicationScoped
public class JdbcAggregationDataStore implements AggregationDataStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAggregationDataStore.class);

    private final DataSource dataSource;
    private final Timer queryTimer;

    @Inject
    public JdbcAggregationDataStore(DataSource dataSource, MeterRegistry registry) {
        this.dataSource = dataSource;
        this.queryTimer = Timer.builder("bi.datastore.query.time")
                .description("Aggregation query execution time")
                .register(registry);
    }

    @Override
    public List<Map<String, Object>> query(SqlRequest request) {
        long start = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(request.sql())) {
            List<Object> params = request.params();
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<Map<String, Object>> rows = resultSetToList(rs);
                log.debug("Executed in {} ms, rows: {}", System.currentTimeMillis() - start, rows.size());
                return rows;
            }
        } catch (SQLException e) {
            throw new DataStoreException("Aggregation query failed: " + e.getMessage(), e);
        } finally {
            queryTimer.record(Duration.ofMillis(System.currentTimeMillis() - start));
        }
    }

    private List<Map<String, Object>> resultSetToList(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columns = md.getColumnCount();
        List<Map<String, Object>> list = new ArrayList<>();
        while (rs.next()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Query interrupted");
            }
            Map<String, Object> row = new LinkedHashMap<>(columns);
            for (int i = 1; i <= columns; i++) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            list.add(row);
        }
        return list;
    }
}
