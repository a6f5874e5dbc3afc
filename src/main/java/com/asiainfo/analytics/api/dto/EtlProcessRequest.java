package com.asiainfo.analytics.api.dto;

import com.asiainfo.analytics.application.etl.EtlSimulator.EtlCommand;
import com.asiainfo.analytics.core.model.etl.QualityRule;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * process-etl 请求体
 */
@RegisterForReflection
public record EtlProcessRequest(
        String operation, // etl_process / data_quality_check / cube_rebuild / lineage_analysis
        String sourceType, // transactional / operational / external / streaming
        String processingMode, // batch / streaming / hybrid，默认 batch
        String targetSchema, // 仅记录日志
        List<QualityRule> qualityRules,
        String processId) {

    public EtlCommand toCommand() {
        return new EtlCommand(operation, sourceType, processingMode, qualityRules, processId);
    }
}
