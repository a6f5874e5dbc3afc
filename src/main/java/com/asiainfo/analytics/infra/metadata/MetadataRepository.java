package com.asiainfo.analytics.infra.metadata;

import com.asiainfo.analytics.common.exception.EntityNotFoundException;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.CubeDefinition;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.lineage.LineageRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 立方体、ETL 流程、数据血缘的内存注册表
 * 启动时从 classpath 下 registry/*.json 加载；ETL 快照在每次运行后整体替换
 */
@ApplicationScoped
public class MetadataRepository {

    private static final Logger log = LoggerFactory.getLogger(MetadataRepository.class);

    static final String CUBES_RESOURCE = "registry/cubes.json";
    static final String ETL_RESOURCE = "registry/etl-processes.json";
    static final String LINEAGE_RESOURCE = "registry/lineage.json";

    private final Map<String, CubeDefinition> cubes = new ConcurrentHashMap<>();
    private final Map<String, EtlProcess> etlProcesses = new ConcurrentHashMap<>();
    private final Map<String, LineageRecord> lineage = new ConcurrentHashMap<>();

    @Inject
    public MetadataRepository(ObjectMapper objectMapper) {
        load(objectMapper, CUBES_RESOURCE, new TypeReference<List<CubeDefinition>>() {
        }).forEach(c -> cubes.put(c.id(), c));
        load(objectMapper, ETL_RESOURCE, new TypeReference<List<EtlProcess>>() {
        }).forEach(p -> etlProcesses.put(p.id(), p));
        load(objectMapper, LINEAGE_RESOURCE, new TypeReference<List<LineageRecord>>() {
        }).forEach(l -> lineage.put(l.entityId(), l));

        log.info("Metadata loaded: {} cubes, {} etl processes, {} lineage records",
                cubes.size(), etlProcesses.size(), lineage.size());
    }

    private static <T> List<T> load(ObjectMapper mapper, String resource, TypeReference<List<T>> type) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = MetadataRepository.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Registry resource not found: {}", resource);
                return List.of();
            }
            return mapper.readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load registry resource " + resource, e);
        }
    }

    // ========== Cube ==========

    public CubeDefinition cube(String cubeId) {
        CubeDefinition cube = cubeId == null ? null : cubes.get(cubeId);
        if (cube == null) {
            throw new EntityNotFoundException("Cube", cubeId);
        }
        return cube;
    }

    public List<CubeDefinition> cubes() {
        List<CubeDefinition> list = new ArrayList<>(cubes.values());
        list.sort(Comparator.comparing(CubeDefinition::id));
        return list;
    }

    // ========== ETL ==========

    public EtlProcess etlProcess(String processId) {
        EtlProcess process = processId == null ? null : etlProcesses.get(processId);
        if (process == null) {
            throw new EntityNotFoundException("ETL process", processId);
        }
        return process;
    }

    public List<EtlProcess> etlProcesses() {
        List<EtlProcess> list = new ArrayList<>(etlProcesses.values());
        list.sort(Comparator.comparing(EtlProcess::id));
        return list;
    }

    public void saveEtlProcess(EtlProcess process) {
        etlProcesses.put(process.id(), process);
    }

    // ========== Lineage ==========

    /**
     * 按实体 ID 查询血缘，entityType 不为空时必须与登记的类型一致
     */
    public LineageRecord lineage(String entityId, String entityType) {
        LineageRecord.EntityType type = null;
        if (entityType != null && !entityType.isBlank()) {
            try {
                type = LineageRecord.EntityType.valueOf(entityType.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("entityType", "Unsupported entity type: " + entityType);
            }
        }

        LineageRecord record = entityId == null ? null : lineage.get(entityId);
        if (record == null) {
            throw new EntityNotFoundException("Lineage entity", entityId);
        }
        if (type != null && type != record.entityType()) {
            throw new ValidationException("entityType",
                    "Entity " + entityId + " is a " + record.entityType() + ", not a " + type);
        }
        return record;
    }
}
