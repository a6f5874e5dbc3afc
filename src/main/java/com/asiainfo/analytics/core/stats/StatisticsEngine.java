package com.asiainfo.analytics.core.stats;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.ResultRow;
import com.asiainfo.analytics.core.model.SummaryStatistics;
import com.asiainfo.analytics.core.model.SummaryStatistics.DimensionStats;
import com.asiainfo.analytics.core.model.SummaryStatistics.MeasureStats;
import com.asiainfo.analytics.core.model.SummaryStatistics.ValueCount;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结果集描述统计
 */
@ApplicationScoped
public class StatisticsEngine {

    static final String UNKNOWN = "unknown";

    private static final double[] PERCENTILES = {0.25, 0.50, 0.75, 0.90, 0.95};

    public SummaryStatistics calculate(List<ResultRow> rows, AggregationRequest request) {
        Map<String, DimensionStats> dimensionStats = new LinkedHashMap<>();
        for (String dim : request.dimensions()) {
            dimensionStats.put(dim, dimensionStats(rows, dim));
        }

        Map<String, MeasureStats> measureStats = new LinkedHashMap<>();
        for (String measure : request.measures()) {
            double[] values = rows.stream()
                    .map(r -> r.measureValues().get(measure))
                    .filter(v -> v != null)
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            measureStats.put(measure, measureStats(values));
        }

        return new SummaryStatistics(rows.size(), dimensionStats, measureStats);
    }

    private DimensionStats dimensionStats(List<ResultRow> rows, String dim) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        int nullCount = 0;
        for (ResultRow row : rows) {
            Object value = row.dimensionValues().get(dim);
            if (value == null || UNKNOWN.equals(value)) {
                nullCount++;
            }
            counts.merge(value, 1, Integer::sum);
        }

        int total = rows.size();
        List<ValueCount> distribution = new ArrayList<>(counts.size());
        counts.forEach((value, count) ->
                distribution.add(new ValueCount(value, count, total == 0 ? 0 : count * 100.0 / total)));
        // 稳定排序，计数相同保持首次出现顺序
        distribution.sort(Comparator.comparingInt(ValueCount::count).reversed());

        return new DimensionStats(counts.size(), nullCount, distribution);
    }

    /**
     * 标准差为总体标准差；分位数取升序数组下标 floor(n*p)，不做插值
     */
    static MeasureStats measureStats(double[] values) {
        int n = values.length;
        if (n == 0) {
            Map<String, Double> zeros = new LinkedHashMap<>();
            for (double p : PERCENTILES) {
                zeros.put(percentileKey(p), 0.0);
            }
            return new MeasureStats(0, 0, 0, 0, 0, zeros);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double avg = sum / n;
        double sq = 0;
        for (double v : sorted) {
            sq += (v - avg) * (v - avg);
        }
        double stdDev = Math.sqrt(sq / n);

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (double p : PERCENTILES) {
            int idx = (int) Math.floor(n * p);
            percentiles.put(percentileKey(p), sorted[Math.min(idx, n - 1)]);
        }

        return new MeasureStats(sum, avg, sorted[0], sorted[n - 1], stdDev, percentiles);
    }

    private static String percentileKey(double p) {
        return "p" + Math.round(p * 100);
    }
}
