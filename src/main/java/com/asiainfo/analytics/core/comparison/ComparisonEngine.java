package com.asiainfo.analytics.core.comparison;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.Comparison;
import com.asiainfo.analytics.core.model.Comparison.PreviousPeriod;
import com.asiainfo.analytics.core.model.DateRange;
import com.asiainfo.analytics.core.model.ResultRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 环比计算：当前窗口与等长的上一窗口按度量汇总后比较
 */
@ApplicationScoped
public class ComparisonEngine {

    private final BenchmarkProvider benchmarkProvider;

    @Inject
    public ComparisonEngine(BenchmarkProvider benchmarkProvider) {
        this.benchmarkProvider = benchmarkProvider;
    }

    /**
     * 上一窗口：长度相同，结束于当前窗口的开始
     */
    public DateRange previousWindow(AggregationRequest request) {
        return request.dateRange().previous();
    }

    public Comparison compare(AggregationRequest request, List<ResultRow> current, List<ResultRow> previous) {
        Map<String, Double> currentTotal = new LinkedHashMap<>();
        Map<String, Double> previousTotal = new LinkedHashMap<>();
        Map<String, Double> change = new LinkedHashMap<>();
        Map<String, Double> changePercentage = new LinkedHashMap<>();

        for (String measure : request.measures()) {
            double cur = total(current, measure);
            double prev = total(previous, measure);
            currentTotal.put(measure, cur);
            previousTotal.put(measure, prev);
            change.put(measure, cur - prev);
            changePercentage.put(measure, prev != 0 ? (cur - prev) / prev * 100 : 0.0);
        }

        PreviousPeriod period = new PreviousPeriod(previousWindow(request), currentTotal, previousTotal,
                change, changePercentage);
        return new Comparison(period, benchmarkProvider.benchmark(request));
    }

    static double total(List<ResultRow> rows, String measure) {
        double sum = 0;
        for (ResultRow row : rows) {
            Double v = row.measureValues().get(measure);
            if (v != null) {
                sum += v;
            }
        }
        return sum;
    }
}
