package com.asiainfo.analytics.core.model.etl;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 转换步骤
 */
@RegisterForReflection
public record TransformationStep(
        int step,
        StepKind kind,
        String description,
        String logic, // 规则文本，如 status IN (completed, pending) AND amount > 0
        List<String> inputColumns,
        List<String> outputColumns,
        double rejectionRate // 模拟拒绝率，取值 [0, 1]
) {

    public TransformationStep {
        inputColumns = inputColumns == null ? List.of() : List.copyOf(inputColumns);
        outputColumns = outputColumns == null ? List.of() : List.copyOf(outputColumns);
    }

    public enum StepKind {
        FILTER, AGGREGATE, JOIN, CALCULATE, VALIDATE, CLEANSE
    }
}
