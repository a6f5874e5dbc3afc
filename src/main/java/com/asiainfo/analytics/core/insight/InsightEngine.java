package com.asiainfo.analytics.core.insight;

import com.asiainfo.analytics.config.EngineConfig;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.Insight;
import com.asiainfo.analytics.core.model.InsightType;
import com.asiainfo.analytics.core.model.ResultRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 自动洞察：趋势、异常、相关性
 */
@ApplicationScoped
public class InsightEngine {

    static final String TIME_DIMENSION = "time";
    static final int MIN_TREND_POINTS = 3;
    static final int MIN_ANOMALY_VALUES = 6;
    static final double ANOMALY_SIGMA = 2.5;
    static final double CORRELATION_THRESHOLD = 0.7;

    private final EngineConfig config;

    @Inject
    public InsightEngine(EngineConfig config) {
        this.config = config;
    }

    public List<Insight> generate(List<ResultRow> rows, AggregationRequest request) {
        List<Insight> insights = new ArrayList<>();

        // 1. 趋势：按时间桶汇总后做最小二乘
        if (request.dimensions().contains(TIME_DIMENSION)) {
            for (String measure : request.measures()) {
                List<Double> series = bucketSeries(rows, measure);
                if (series.size() < MIN_TREND_POINTS) {
                    continue;
                }
                Trend trend = Trend.of(series);
                if (Math.abs(trend.slope()) > config.getTrendSlopeThreshold()) {
                    boolean up = trend.slope() > 0;
                    insights.add(new Insight(
                            InsightType.TREND,
                            List.of(measure),
                            String.format(Locale.ROOT, "%s shows %s trend with %.1f%% rate",
                                    measure, up ? "upward" : "downward", Math.abs(trend.slope() * 100)),
                            Math.min(1, Math.abs(trend.slope()) * 2),
                            trend.rSquared(),
                            up ? "Continue strategies driving " + measure + " growth"
                                    : "Address factors causing " + measure + " decline"));
                }
            }
        }

        // 2. 异常：超出 2.5 倍标准差
        for (String measure : request.measures()) {
            List<Double> values = values(rows, measure);
            if (values.size() < MIN_ANOMALY_VALUES) {
                continue;
            }
            int anomalies = countAnomalies(values);
            if (anomalies > 0) {
                insights.add(new Insight(
                        InsightType.ANOMALY,
                        List.of(measure),
                        "Detected " + anomalies + " anomalies in " + measure + " data",
                        0.8,
                        0.75,
                        "Investigate unusual patterns in " + measure + " for potential issues or opportunities"));
            }
        }

        // 3. 相关性：度量两两组合
        List<String> measures = request.measures();
        for (int i = 0; i < measures.size(); i++) {
            for (int j = i + 1; j < measures.size(); j++) {
                List<Double> x = values(rows, measures.get(i));
                List<Double> y = values(rows, measures.get(j));
                if (x.size() != y.size() || x.size() <= 2) {
                    continue;
                }
                double r = pearson(x, y);
                if (Math.abs(r) > CORRELATION_THRESHOLD) {
                    String pair = measures.get(i) + "_" + measures.get(j);
                    insights.add(new Insight(
                            InsightType.CORRELATION,
                            List.of(measures.get(i), measures.get(j)),
                            String.format(Locale.ROOT, "Strong %s correlation (%.1f%%) between %s",
                                    r > 0 ? "positive" : "negative", r * 100, pair),
                            Math.abs(r),
                            0.85,
                            "Leverage " + pair + " relationship for predictive modeling and optimization"));
                }
            }
        }

        insights.sort(Comparator.comparingDouble(Insight::significance).reversed());
        return insights;
    }

    /**
     * 同一时间桶内的多行（如多个租户）先求和，再按桶名升序排列
     * 桶名格式固定宽度，字典序即时间顺序
     */
    static List<Double> bucketSeries(List<ResultRow> rows, String measure) {
        Map<String, Double> buckets = new TreeMap<>();
        for (ResultRow row : rows) {
            Object bucket = row.dimensionValues().get(TIME_DIMENSION);
            Double value = row.measureValues().get(measure);
            if (bucket == null || value == null) {
                continue;
            }
            buckets.merge(bucket.toString(), value, Double::sum);
        }
        return new ArrayList<>(buckets.values());
    }

    private static List<Double> values(List<ResultRow> rows, String measure) {
        return rows.stream()
                .map(r -> r.measureValues().get(measure))
                .filter(Objects::nonNull)
                .toList();
    }

    static int countAnomalies(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
        double stdDev = Math.sqrt(variance);
        return (int) values.stream().filter(v -> Math.abs(v - mean) > ANOMALY_SIGMA * stdDev).count();
    }

    /**
     * Pearson 相关系数，分母为 0 时返回 0
     */
    static double pearson(List<Double> x, List<Double> y) {
        int n = x.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0, sumYY = 0;
        for (int i = 0; i < n; i++) {
            double a = x.get(i);
            double b = y.get(i);
            sumX += a;
            sumY += b;
            sumXY += a * b;
            sumXX += a * a;
            sumYY += b * b;
        }
        double numerator = n * sumXY - sumX * sumY;
        double denominator = Math.sqrt((n * sumXX - sumX * sumX) * (n * sumYY - sumY * sumY));
        return denominator == 0 || Double.isNaN(denominator) ? 0 : numerator / denominator;
    }

    /**
     * 以下标为自变量的最小二乘拟合
     */
    record Trend(double slope, double rSquared) {

        static Trend of(List<Double> values) {
            int n = values.size();
            double xMean = (n - 1) / 2.0;
            double yMean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);

            double numerator = 0;
            double denominator = 0;
            for (int i = 0; i < n; i++) {
                numerator += (i - xMean) * (values.get(i) - yMean);
                denominator += (i - xMean) * (i - xMean);
            }
            double slope = denominator != 0 ? numerator / denominator : 0;

            double ssRes = 0;
            double ssTot = 0;
            for (int i = 0; i < n; i++) {
                double predicted = yMean + slope * (i - xMean);
                ssRes += Math.pow(values.get(i) - predicted, 2);
                ssTot += Math.pow(values.get(i) - yMean, 2);
            }
            double rSquared = ssTot > 0 ? 1 - ssRes / ssTot : 0;
            return new Trend(slope, rSquared);
        }
    }
}
