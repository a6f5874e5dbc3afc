package com.asiainfo.analytics.api;

import com.asiainfo.analytics.api.dto.ApiResult;
import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.CubeDefinition;
import com.asiainfo.analytics.core.model.lineage.LineageRecord;
import com.asiainfo.analytics.infra.metadata.MetadataRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 立方体与数据血缘查询
 */
@ApplicationScoped
@Path("/api/v1/bi")
@Produces(MediaType.APPLICATION_JSON)
public class MetadataResource {

    private static final Logger log = LoggerFactory.getLogger(MetadataResource.class);

    private final MetadataRepository repository;

    @Inject
    public MetadataResource(MetadataRepository repository) {
        this.repository = repository;
    }

    @GET
    @Path("/cubes")
    public ApiResult<List<CubeDefinition>> cubes() {
        return ApiResult.success(repository.cubes(), "");
    }

    @GET
    @Path("/cube")
    public ApiResult<CubeDefinition> cube(@QueryParam("cubeId") String cubeId) {
        try {
            if (cubeId == null || cubeId.isBlank()) {
                throw new ValidationException("cubeId", "cubeId is required");
            }
            return ApiResult.success(repository.cube(cubeId), "");
        } catch (ValidationException | EntityNotFoundException e) {
            log.warn("立方体查询失败: {}", e.getMessage());
            return ApiResult.fromException(e);
        }
    }

    @GET
    @Path("/lineage")
    public ApiResult<LineageRecord> lineage(@QueryParam("entityId") String entityId,
                                            @QueryParam("entityType") String entityType) {
        try {
            if (entityId == null || entityId.isBlank()) {
                throw new ValidationException("entityId", "entityId is required");
            }
            return ApiResult.success(repository.lineage(entityId, entityType), "");
        } catch (ValidationException | EntityNotFoundException e) {
            log.warn("血缘查询失败: {}", e.getMessage());
            return ApiResult.fromException(e);
        }
    }
}
