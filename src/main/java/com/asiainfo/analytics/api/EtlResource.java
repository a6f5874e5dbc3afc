package com.asiainfo.analytics.api;

import com.asiainfo.analytics.api.dto.ApiResult;
import com.asiainfo.analytics.api.dto.EtlProcessRequest;
import com.asiainfo.analytics.application.etl.EtlSimulator;
import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * ETL 模拟运行与状态查询
 */
@ApplicationScoped
@Path("/api/v1/bi")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EtlResource {

    private static final Logger log = LoggerFactory.getLogger(EtlResource.class);

    private final EtlSimulator simulator;

    @Inject
    public EtlResource(EtlSimulator simulator) {
        this.simulator = simulator;
    }

    @POST
    @Path("/process-etl")
    public ApiResult<EtlProcess> processEtl(EtlProcessRequest request) {
        try {
            if (request == null) {
                throw new ValidationException("body", "Request body is required");
            }
            log.info("收到 ETL 请求: operation={}, sourceType={}, mode={}, targetSchema={}",
                    request.operation(), request.sourceType(), request.processingMode(), request.targetSchema());
            EtlProcess process = simulator.processEtl(request.toCommand());
            return ApiResult.success(process, "ETL 执行完成，状态: " + process.monitoring().status());
        } catch (ValidationException | EntityNotFoundException e) {
            log.warn("ETL 请求被拒绝: {}", e.getMessage());
            return ApiResult.fromException(e);
        } catch (Exception e) {
            log.error("ETL 执行失败: {}", e.getMessage(), e);
            return ApiResult.fromException(e);
        }
    }

    @GET
    @Path("/etl-status")
    public ApiResult<List<EtlProcess>> etlStatus(@QueryParam("processId") String processId) {
        try {
            return ApiResult.success(simulator.etlStatus(processId), "");
        } catch (EntityNotFoundException e) {
            return ApiResult.fromException(e);
        } catch (Exception e) {
            log.error("ETL 状态查询失败: {}", e.getMessage(), e);
            return ApiResult.fromException(e);
        }
    }
}
