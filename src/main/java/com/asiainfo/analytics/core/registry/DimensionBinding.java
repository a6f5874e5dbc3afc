package com.asiainfo.analytics.core.registry;

import com.asiainfo.analytics.core.model.TimeGranularity;

import java.util.List;

/**
 * 维度到物理列的绑定
 * 时间维度按粒度截断，其余维度直接取列值
 */
public record DimensionBinding(
        String id,
        String selectColumn, // 输出列
        List<String> groupColumns, // GROUP BY 列，tenant 按 id + name 分组
        boolean temporal) {

    public DimensionBinding {
        groupColumns = List.copyOf(groupColumns);
    }

    public static DimensionBinding temporal(String id, String column) {
        return new DimensionBinding(id, column, List.of(column), true);
    }

    public static DimensionBinding column(String id, String column) {
        return new DimensionBinding(id, column, List.of(column), false);
    }

    public String selectExpression(TimeGranularity granularity) {
        return temporal ? granularity.sqlExpression(selectColumn) : selectColumn;
    }

    public List<String> groupExpressions(TimeGranularity granularity) {
        if (temporal) {
            return List.of(granularity.sqlExpression(selectColumn));
        }
        return groupColumns;
    }
}
