package com.asiainfo.analytics.api;

import com.asiainfo.analytics.api.dto.ApiResult;
import com.asiainfo.analytics.api.dto.EtlProcessRequest;
import com.asiainfo.analytics.application.etl.EtlSimulator;
import com.asiainfo.analytics.application.etl.EtlSimulator.EtlCommand;
import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.etl.EtlMonitoring;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.etl.EtlStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtlResourceTest {

    @Mock
    EtlSimulator simulator;

    private EtlResource resource;

    @BeforeEach
    void setUp() {
        resource = new EtlResource(simulator);
    }

    private static EtlProcess snapshot(EtlStatus status) {
        EtlMonitoring monitoring = new EtlMonitoring("etl_process_transactional_1", "etl_process", "transactional",
                "batch", status, Instant.parse("2024-03-11T00:00:00Z"), 0.3, 3, 3000, 2970, 297, 30, 1.0,
                10000, 128, 0.5);
        return new EtlProcess("revenue_etl", "Revenue", null, EtlProcess.ProcessType.FULL_ETL, null, List.of(),
                null, null, monitoring, null);
    }

    @Test
    void testProcessEtl() {
        when(simulator.processEtl(any())).thenReturn(snapshot(EtlStatus.SUCCESS));

        ApiResult<EtlProcess> response = resource.processEtl(
                new EtlProcessRequest("etl_process", "transactional", null, "analytics", null, null));

        assertEquals(ApiResult.SUCCESS, response.status());
        assertTrue(response.msg().contains("SUCCESS"));
        ArgumentCaptor<EtlCommand> captor = ArgumentCaptor.forClass(EtlCommand.class);
        verify(simulator).processEtl(captor.capture());
        assertEquals("transactional", captor.getValue().sourceType());
    }

    @Test
    void testProcessEtlValidation() {
        when(simulator.processEtl(any())).thenThrow(new ValidationException("operation", "Unsupported operation: x"));

        ApiResult<EtlProcess> response = resource.processEtl(
                new EtlProcessRequest("x", "transactional", null, null, null, null));

        assertEquals(ApiResult.VALIDATION_FAILED, response.status());
        assertEquals(ApiResult.VALIDATION_FAILED, resource.processEtl(null).status());
    }

    @Test
    void testEtlStatus() {
        when(simulator.etlStatus("revenue_etl")).thenReturn(List.of(snapshot(EtlStatus.WARNING)));
        when(simulator.etlStatus("ghost")).thenThrow(new EntityNotFoundException("ETL process", "ghost"));

        ApiResult<List<EtlProcess>> found = resource.etlStatus("revenue_etl");
        assertEquals(ApiResult.SUCCESS, found.status());
        assertEquals(EtlStatus.WARNING, found.data().get(0).monitoring().status());

        ApiResult<List<EtlProcess>> missing = resource.etlStatus("ghost");
        assertEquals(ApiResult.NOT_FOUND, missing.status());
        assertEquals("ETL process not found: ghost", missing.msg());
    }
}
