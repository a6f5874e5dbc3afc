package com.asiainfo.analytics.core.comparison;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.Comparison.Benchmark;

/**
 * 对标数据来源
 */
public interface BenchmarkProvider {

    Benchmark benchmark(AggregationRequest request);
}
