package com.asiainfo.analytics.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 生成的聚合 SQL 及其按占位符顺序排列的绑定参数
 */
public record SqlRequest(String sql, List<Object> params) {

    public SqlRequest {
        // 参数允许为 null（可空过滤值），不能用 List.copyOf
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }
}
