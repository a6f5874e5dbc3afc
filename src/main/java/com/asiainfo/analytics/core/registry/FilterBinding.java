package com.asiainfo.analytics.core.registry;

/**
 * 过滤条件 key 到 WHERE 子句片段的绑定
 */
public record FilterBinding(String key, String column, String operator, boolean numeric) {

    public String predicate() {
        return column + " " + operator + " ?";
    }
}
