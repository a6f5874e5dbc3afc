package com.asiainfo.analytics.core.model.etl;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * ETL 流程定义及最近一次运行快照
 * 每次运行生成新的快照替换旧快照
 */
@RegisterForReflection
public record EtlProcess(
        String id,
        String name,
        String description,
        ProcessType type,
        SourceDescriptor source,
        List<TransformationStep> transformations, // 按 step 升序执行
        TargetDescriptor target,
        Schedule schedule,
        EtlMonitoring monitoring,
        DataQuality dataQuality) {

    public EtlProcess {
        transformations = transformations == null ? List.of() : List.copyOf(transformations);
    }

    public EtlProcess withRun(EtlMonitoring newMonitoring, DataQuality newQuality) {
        return new EtlProcess(id, name, description, type, source, transformations, target, schedule,
                newMonitoring, newQuality);
    }

    public enum ProcessType {
        EXTRACT, TRANSFORM, LOAD, FULL_ETL
    }

    @RegisterForReflection
    public record SourceDescriptor(String type, String connection, String schema, List<String> tables) {

        public SourceDescriptor {
            tables = tables == null ? List.of() : List.copyOf(tables);
        }
    }

    @RegisterForReflection
    public record TargetDescriptor(String type, String connection, String schema, String table, String mode) {
    }

    @RegisterForReflection
    public record Schedule(String frequency, String time, String timezone, List<String> dependencies) {

        public Schedule {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }
    }

    /**
     * 质量规则集合、综合得分和趋势
     */
    @RegisterForReflection
    public record DataQuality(List<QualityRule> rules, double overallScore, QualityTrend trend) {

        public DataQuality {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }
}
