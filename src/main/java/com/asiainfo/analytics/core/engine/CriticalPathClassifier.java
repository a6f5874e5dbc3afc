package com.asiainfo.analytics.core.engine;

import com.asiainfo.analytics.config.EngineConfig;
import com.asiainfo.analytics.core.model.AggregationRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * 关键路径判定：度量、维度都在白名单内且数量不超过上限
 */
@ApplicationScoped
public class CriticalPathClassifier {

    private final EngineConfig config;

    @Inject
    public CriticalPathClassifier(EngineConfig config) {
        this.config = config;
    }

    public boolean isCritical(AggregationRequest request) {
        return request.dimensions().size() <= config.getCriticalMaxDimensions()
                && request.measures().size() <= config.getCriticalMaxMeasures()
                && config.getCriticalMeasures().containsAll(request.measures())
                && config.getCriticalDimensions().containsAll(request.dimensions());
    }
}
