package com.asiainfo.analytics.application.etl;

import com.asiainfo.analytics.config.EtlConfig;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.etl.QualityTrend;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * 与上一次运行的综合得分比较，差值在容差内视为稳定
 */
@DefaultBean
@ApplicationScoped
public class ScoreDeltaTrendPolicy implements EtlTrendPolicy {

    private final double tolerance;

    @Inject
    public ScoreDeltaTrendPolicy(EtlConfig config) {
        this.tolerance = config.getTrendTolerance();
    }

    @Override
    public QualityTrend trend(EtlProcess previous, double currentScore) {
        if (previous == null || previous.dataQuality() == null) {
            return QualityTrend.STABLE;
        }
        double delta = currentScore - previous.dataQuality().overallScore();
        if (delta > tolerance) {
            return QualityTrend.IMPROVING;
        }
        if (delta < -tolerance) {
            return QualityTrend.DEGRADING;
        }
        return QualityTrend.STABLE;
    }
}
