package com.asiainfo.analytics.core.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * 数据立方体定义
 * 启动时从静态配置加载，之后只读
 */
@RegisterForReflection
public record CubeDefinition(
        String id,
        String name,
        String description,
        List<Dimension> dimensions,
        List<Measure> measures,
        String factTable, // 事实表
        RefreshFrequency refreshFrequency,
        Instant lastRefresh,
        QualityScore dataQuality,
        SizeStats size,
        Partitioning partitioning) {

    public CubeDefinition {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        measures = measures == null ? List.of() : List.copyOf(measures);
    }

    public enum RefreshFrequency {
        REAL_TIME, HOURLY, DAILY, WEEKLY
    }

    public enum PartitionStrategy {
        TIME, HASH, RANGE
    }

    /**
     * 五项质量分 + 综合分
     */
    @RegisterForReflection
    public record QualityScore(
            double completeness,
            double accuracy,
            double consistency,
            double timeliness,
            double validity,
            double overall) {
    }

    @RegisterForReflection
    public record SizeStats(long rows, long compressedBytes, long uncompressedBytes) {
    }

    @RegisterForReflection
    public record Partitioning(PartitionStrategy strategy, List<String> columns, int partitions) {

        public Partitioning {
            columns = columns == null ? List.of() : List.copyOf(columns);
        }
    }
}
