package com.asiainfo.analytics.core.model.etl;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * 数据质量规则
 * threshold 为步骤通过率下限（百分比），低于阈值即违规
 */
@RegisterForReflection
public record QualityRule(
        String id,
        String name,
        RuleKind kind,
        String expression,
        double threshold,
        RuleAction action,
        RuleStatus status,
        long violationCount) {

    public QualityRule withResult(RuleStatus newStatus, long newViolationCount) {
        return new QualityRule(id, name, kind, expression, threshold, action, newStatus, newViolationCount);
    }

    /**
     * 重置为本次运行的初始状态
     */
    public QualityRule reset() {
        return withResult(RuleStatus.PASSED, 0);
    }

    public enum RuleKind {
        COMPLETENESS, VALIDITY, ACCURACY, CONSISTENCY, UNIQUENESS
    }

    public enum RuleAction {
        WARN, REJECT, FIX
    }

    public enum RuleStatus {
        PASSED, WARNING, FAILED
    }
}
