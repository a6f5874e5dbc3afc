package com.asiainfo.analytics.core.model.lineage;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * 数据血缘记录
 * 静态声明的元数据，并非由真实依赖图计算得出
 */
@RegisterForReflection
public record LineageRecord(
        String entityId,
        EntityType entityType,
        String entityName,
        List<Upstream> upstream,
        List<Downstream> downstream,
        Metadata metadata,
        QualityMetrics qualityMetrics) {

    public LineageRecord {
        upstream = upstream == null ? List.of() : List.copyOf(upstream);
        downstream = downstream == null ? List.of() : List.copyOf(downstream);
    }

    public enum EntityType {
        TABLE, VIEW, COLUMN, REPORT, DASHBOARD, CUBE, METRIC
    }

    public enum Relationship {
        DIRECT, INDIRECT
    }

    public enum Impact {
        CRITICAL, HIGH, MEDIUM, LOW
    }

    @RegisterForReflection
    public record Upstream(
            String entityId,
            String entityName,
            String entityType,
            Relationship relationship,
            List<String> transformations,
            double confidence) {
    }

    @RegisterForReflection
    public record Downstream(
            String entityId,
            String entityName,
            String entityType,
            Relationship relationship,
            String usage, // report / dashboard / api / export
            Impact impact) {
    }

    @RegisterForReflection
    public record Metadata(
            String owner,
            String steward,
            String classification,
            List<String> tags,
            List<String> businessTerms,
            List<String> technicalTerms,
            Instant lastUpdated) {
    }

    @RegisterForReflection
    public record QualityMetrics(
            double completeness,
            double accuracy,
            double consistency,
            double timeliness,
            double usage,
            double trust) {
    }
}
