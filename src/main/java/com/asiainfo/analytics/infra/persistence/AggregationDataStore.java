package com.asiainfo.analytics.infra.persistence;

import com.asiainfo.analytics.core.model.SqlRequest;

import java.util.List;
import java.util.Map;

/**
 * 聚合查询的数据源
 * 返回列名到值的行列表，失败时抛出 DataStoreException
 */
public interface AggregationDataStore {

    List<Map<String, Object>> query(SqlRequest request);
}
