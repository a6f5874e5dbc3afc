package com.asiainfo.analytics.api;

import com.asiainfo.analytics.api.dto.AggregationQuery;
import com.asiainfo.analytics.api.dto.ApiResult;
import com.asiainfo.analytics.common.exception.CriticalPathTimeoutException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.engine.AggregationEngine;
import com.asiainfo.analytics.core.model.AggregationResult;
import com.asiainfo.analytics.infra.cache.CacheManager;
import com.asiainfo.analytics.infra.cache.CacheStats;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 多维聚合查询 REST API
 */
@ApplicationScoped
@Path("/api/v1/bi")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AggregationResource {

    private static final Logger log = LoggerFactory.getLogger(AggregationResource.class);

    private final AggregationEngine engine;
    private final CacheManager cacheManager;

    @Inject
    public AggregationResource(AggregationEngine engine, CacheManager cacheManager) {
        this.engine = engine;
        this.cacheManager = cacheManager;
    }

    /**
     * 执行聚合查询
     *
     * @param query 查询请求
     * @return 聚合结果（data, status, msg）
     */
    @POST
    @Path("/aggregate")
    public ApiResult<AggregationResult> aggregate(AggregationQuery query) {
        long start = System.currentTimeMillis();
        try {
            if (query == null) {
                throw new ValidationException("body", "Request body is required");
            }
            log.info("收到聚合请求: {}", query);
            AggregationResult result = engine.aggregate(query.toRequest());
            return ApiResult.success(result, "查询成功！返回 " + result.rows().size() + " 条记录，耗时 "
                    + (System.currentTimeMillis() - start) + " ms");
        } catch (ValidationException | CriticalPathTimeoutException e) {
            log.warn("聚合请求被拒绝: {}", e.getMessage());
            return ApiResult.fromException(e);
        } catch (Exception e) {
            log.error("聚合查询失败: {}", e.getMessage(), e);
            return ApiResult.fromException(e);
        }
    }

    @GET
    @Path("/cache/stats")
    public ApiResult<CacheStats> cacheStats() {
        return ApiResult.success(cacheManager.getStats(), "");
    }
}
