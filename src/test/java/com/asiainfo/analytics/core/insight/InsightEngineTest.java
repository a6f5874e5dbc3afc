package com.asiainfo.analytics.core.insight;

import com.asiainfo.analytics.config.EngineConfig;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.Insight;
import com.asiainfo.analytics.core.model.InsightType;
import com.asiainfo.analytics.core.model.ResultRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InsightEngineTest {

    private final InsightEngine engine = new InsightEngine(EngineConfig.defaults());

    private static ResultRow row(String day, String tenant, double revenue, double orders) {
        return new ResultRow(Map.of("time", day, "tenant", tenant),
                Map.of("revenue", revenue, "orders", orders),
                new ResultRow.RowMetadata(1, 0.95, 0.92));
    }

    private static AggregationRequest request(List<String> dims) {
        return new AggregationRequest(dims, List.of("revenue", "orders"), null, null, null, null, false, false);
    }

    @Test
    void testDownwardTrendOverBucketSums() {
        List<ResultRow> rows = new ArrayList<>();
        for (int d = 0; d < 5; d++) {
            String day = "2024-03-0" + (d + 1);
            rows.add(row(day, "a", 100 - 10 * d, 5));
            rows.add(row(day, "b", 50, 5));
        }

        List<Insight> insights = engine.generate(rows, request(List.of("time", "tenant")));

        assertEquals(1, insights.size());
        Insight trend = insights.get(0);
        assertEquals(InsightType.TREND, trend.type());
        assertEquals("revenue shows downward trend with 1000.0% rate", trend.description());
        assertEquals(1.0, trend.significance());
        assertEquals(1.0, trend.confidence(), 1e-9);
        assertEquals("Address factors causing revenue decline", trend.recommendation());
    }

    @Test
    void testBucketSeriesSortsBuckets() {
        List<ResultRow> rows = List.of(
                row("2024-03-03", "a", 3, 0), row("2024-03-01", "a", 1, 0), row("2024-03-01", "b", 1, 0));

        assertEquals(List.of(2.0, 3.0), InsightEngine.bucketSeries(rows, "revenue"));
    }

    @Test
    void testNoTrendWithoutTimeDimension() {
        List<ResultRow> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(row("2024-03-0" + (i + 1), "t" + i, i * 100, 1));
        }

        List<Insight> insights = engine.generate(rows, request(List.of("tenant")));

        assertTrue(insights.stream().noneMatch(i -> i.type() == InsightType.TREND));
    }

    @Test
    void testAnomalyDetection() {
        List<Double> values = List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 100.0);
        assertEquals(1, InsightEngine.countAnomalies(values));
        assertEquals(0, InsightEngine.countAnomalies(List.of(5.0, 5.0, 5.0, 5.0, 5.0, 5.0)));

        List<ResultRow> rows = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            rows.add(row("d", "t" + i, values.get(i), 1));
        }
        List<Insight> insights = engine.generate(rows, request(List.of("tenant")));

        Insight anomaly = insights.stream().filter(i -> i.type() == InsightType.ANOMALY).findFirst().orElseThrow();
        assertEquals("Detected 1 anomalies in revenue data", anomaly.description());
        assertEquals(0.8, anomaly.significance());
    }

    @Test
    void testTooFewValuesForAnomaly() {
        List<ResultRow> rows = new ArrayList<>();
        for (double v : new double[]{1, 1, 1, 1, 1000}) {
            rows.add(row("d", "t" + v, v, 1));
        }

        assertTrue(engine.generate(rows, request(List.of("tenant"))).stream()
                .noneMatch(i -> i.type() == InsightType.ANOMALY));
    }

    @Test
    void testCorrelation() {
        List<ResultRow> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(row("d", "t" + i, i * 100 + 50, i * 2 + 1));
        }

        Insight correlation = engine.generate(rows, request(List.of("tenant"))).stream()
                .filter(i -> i.type() == InsightType.CORRELATION).findFirst().orElseThrow();

        assertEquals(List.of("revenue", "orders"), correlation.measures());
        assertEquals("Strong positive correlation (100.0%) between revenue_orders", correlation.description());
        assertEquals(1.0, correlation.significance(), 1e-9);
    }

    @Test
    void testPearsonSymmetricAndBounded() {
        Random random = new Random(7);
        for (int round = 0; round < 30; round++) {
            List<Double> x = new ArrayList<>();
            List<Double> y = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                x.add(random.nextGaussian());
                y.add(random.nextGaussian());
            }
            double r = InsightEngine.pearson(x, y);
            assertEquals(r, InsightEngine.pearson(y, x), 1e-12);
            assertTrue(r >= -1 - 1e-9 && r <= 1 + 1e-9);
        }
        assertEquals(0, InsightEngine.pearson(List.of(1.0, 1.0, 1.0), List.of(1.0, 2.0, 3.0)));
    }

    @Test
    void testInsightsSortedBySignificance() {
        List<ResultRow> rows = new ArrayList<>();
        for (int d = 0; d < 8; d++) {
            rows.add(row("2024-03-0" + (d + 1), "a", d == 7 ? 1000 : 10 + d * 0.05, d));
        }

        List<Insight> insights = engine.generate(rows, request(List.of("time")));

        assertFalse(insights.isEmpty());
        for (int i = 1; i < insights.size(); i++) {
            assertTrue(insights.get(i - 1).significance() >= insights.get(i).significance());
        }
    }
}
