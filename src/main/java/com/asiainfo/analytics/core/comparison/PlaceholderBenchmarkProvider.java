package com.asiainfo.analytics.core.comparison;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.Comparison.Benchmark;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 默认对标数据：固定示例值，接入真实行业数据时提供新的 BenchmarkProvider 实现即可替换
 */
@DefaultBean
@ApplicationScoped
public class PlaceholderBenchmarkProvider implements BenchmarkProvider {

    static final double INDUSTRY = 1_000_000;
    static final double TARGET = 1_200_000;
    static final double VARIANCE = -15.5;

    @Override
    public Benchmark benchmark(AggregationRequest request) {
        Map<String, Double> industry = new LinkedHashMap<>();
        Map<String, Double> target = new LinkedHashMap<>();
        Map<String, Double> variance = new LinkedHashMap<>();
        for (String measure : request.measures()) {
            industry.put(measure, INDUSTRY);
            target.put(measure, TARGET);
            variance.put(measure, VARIANCE);
        }
        return new Benchmark(industry, target, variance);
    }
}
