package com.asiainfo.analytics.infra.metadata;

import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.CubeDefinition;
import com.asiainfo.analytics.core.model.Dimension;
import com.asiainfo.analytics.core.model.DimensionType;
import com.asiainfo.analytics.core.model.Measure;
import com.asiainfo.analytics.core.model.etl.EtlMonitoring;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.lineage.LineageRecord;
import com.asiainfo.analytics.core.registry.FieldRegistry;
import com.asiainfo.analytics.core.registry.MeasureBinding;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 基于 classpath 下 registry/*.json 的注册表测试
 */
class MetadataRepositoryTest {

    private MetadataRepository repository;

    @BeforeEach
    void setUp() {
        repository = new MetadataRepository(new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void testCubesLoaded() {
        assertEquals(2, repository.cubes().size());
        assertEquals("operational_analytics", repository.cubes().get(0).id());

        CubeDefinition revenue = repository.cube("revenue_analytics");
        assertEquals("time", revenue.dimensions().get(0).id());
        assertEquals(DimensionType.TEMPORAL, revenue.dimensions().get(0).type());
        assertTrue(revenue.measures().stream().anyMatch(m -> m.id().equals("revenue")));
        assertNotNull(revenue.dataQuality());
        assertNotNull(revenue.partitioning());
    }

    @Test
    void testCubeFieldsAreQueryable() {
        // 目录中公布的维度、度量必须能被 /aggregate 接受，且聚合方式一致
        FieldRegistry fields = new FieldRegistry();

        for (CubeDefinition cube : repository.cubes()) {
            for (Dimension dimension : cube.dimensions()) {
                assertTrue(fields.dimension(dimension.id()).isPresent(),
                        cube.id() + " advertises unknown dimension " + dimension.id());
            }
            for (Measure measure : cube.measures()) {
                MeasureBinding binding = fields.measure(measure.id()).orElse(null);
                assertNotNull(binding, cube.id() + " advertises unknown measure " + measure.id());
                assertEquals(binding.kind(), measure.aggregationKind(), cube.id() + "." + measure.id());
            }
        }
    }

    @Test
    void testUnknownCube() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
                () -> repository.cube("nonexistent_cube"));
        assertTrue(e.getMessage().contains("nonexistent_cube"));
        assertThrows(EntityNotFoundException.class, () -> repository.cube(null));
    }

    @Test
    void testSeedEtlMonitoringIsConsistent() {
        EtlMonitoring monitoring = repository.etlProcess("revenue_etl").monitoring();

        assertEquals(monitoring.recordsProcessed(), monitoring.recordsInserted() + monitoring.recordsRejected());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), monitoring.lastRun());
        assertEquals(3, repository.etlProcess("revenue_etl").transformations().size());
        assertEquals(3, repository.etlProcess("revenue_etl").dataQuality().rules().size());
    }

    @Test
    void testSaveReplacesSnapshot() {
        EtlProcess original = repository.etlProcess("operational_etl");
        EtlProcess updated = original.withRun(null, new EtlProcess.DataQuality(null, 42.0, null));

        repository.saveEtlProcess(updated);

        assertSame(updated, repository.etlProcess("operational_etl"));
        assertEquals(2, repository.etlProcesses().size());
    }

    @Test
    void testLineageLookup() {
        LineageRecord record = repository.lineage("revenue_analytics", "cube");

        assertEquals(LineageRecord.EntityType.CUBE, record.entityType());
        assertEquals("payments_table", record.upstream().get(0).entityId());
        assertEquals(LineageRecord.Impact.CRITICAL, record.downstream().get(1).impact());
        assertSame(record, repository.lineage("revenue_analytics", null));
    }

    @Test
    void testLineageTypeErrors() {
        ValidationException mismatch = assertThrows(ValidationException.class,
                () -> repository.lineage("revenue_analytics", "table"));
        assertEquals("entityType", mismatch.getErrors().get(0).field());

        assertThrows(ValidationException.class, () -> repository.lineage("revenue_analytics", "spaceship"));
        assertThrows(EntityNotFoundException.class, () -> repository.lineage("ghost_table", "table"));
    }
}
