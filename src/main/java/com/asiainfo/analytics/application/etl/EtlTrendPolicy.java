package com.asiainfo.analytics.application.etl;

import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.etl.QualityTrend;

/**
 * 数据质量趋势判定
 */
public interface EtlTrendPolicy {

    /**
     * @param previous     本次运行前的流程快照
     * @param currentScore 本次运行的综合得分
     */
    QualityTrend trend(EtlProcess previous, double currentScore);
}
