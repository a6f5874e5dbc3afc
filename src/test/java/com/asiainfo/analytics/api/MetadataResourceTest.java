package com.asiainfo.analytics.api;

import com.asiainfo.analytics.api.dto.ApiResult;
import com.asiainfo.analytics.core.model.CubeDefinition;
import com.asiainfo.analytics.core.model.lineage.LineageRecord;
import com.asiainfo.analytics.infra.metadata.MetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 使用真实注册表数据
 */
class MetadataResourceTest {

    private MetadataResource resource;

    @BeforeEach
    void setUp() {
        resource = new MetadataResource(new MetadataRepository(new ObjectMapper().findAndRegisterModules()));
    }

    @Test
    void testCubes() {
        ApiResult<List<CubeDefinition>> response = resource.cubes();

        assertEquals(ApiResult.SUCCESS, response.status());
        assertEquals(2, response.data().size());
    }

    @Test
    void testCube() {
        assertEquals("revenue_analytics", resource.cube("revenue_analytics").data().id());
        assertEquals(ApiResult.NOT_FOUND, resource.cube("nonexistent_cube").status());
        assertEquals(ApiResult.VALIDATION_FAILED, resource.cube(" ").status());
    }

    @Test
    void testLineage() {
        ApiResult<LineageRecord> response = resource.lineage("payments_table", "table");
        assertEquals(ApiResult.SUCCESS, response.status());
        assertEquals(LineageRecord.EntityType.TABLE, response.data().entityType());

        assertEquals(ApiResult.VALIDATION_FAILED, resource.lineage("payments_table", "cube").status());
        assertEquals(ApiResult.VALIDATION_FAILED, resource.lineage(null, "cube").status());
        assertEquals(ApiResult.NOT_FOUND, resource.lineage("ghost", null).status());
    }
}
