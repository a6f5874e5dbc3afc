package com.asiainfo.analytics.infra.cache;

import com.asiainfo.analytics.core.model.AggregationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 聚合结果缓存Key
 * 维度、度量、过滤条件先排序再序列化为 JSON，字段顺序不同的等价请求得到相同的 Key
 */
public final class CacheKey {

    public static final String PREFIX = "bi:agg:";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String canonical;
    private final String digest;

    private CacheKey(String canonical) {
        this.canonical = canonical;
        this.digest = sha256(canonical);
    }

    /**
     * 为聚合请求创建缓存Key
     */
    public static CacheKey forRequest(AggregationRequest req) {
        List<String> dims = new ArrayList<>(req.dimensions());
        Collections.sort(dims);
        List<String> measures = new ArrayList<>(req.measures());
        Collections.sort(measures);

        // 格式: {"agg":..,"cmp":..,"dims":[..],"filters":{..},"from":..,"gran":..,"measures":[..],"to":..}，键按字母序输出
        // 过滤值按 JSON 转义，值中的分隔符不会与其它过滤条件混淆
        Map<String, Object> parts = new LinkedHashMap<>();
        parts.put("dims", dims);
        parts.put("measures", measures);
        parts.put("from", format(req.dateRange().start()));
        parts.put("to", format(req.dateRange().end()));
        parts.put("filters", new TreeMap<>(req.filters()));
        parts.put("gran", req.timeGranularity().code());
        parts.put("agg", req.aggregationKind().code());
        parts.put("cmp", req.includeComparisons());
        try {
            return new CacheKey(CANONICAL_MAPPER.writeValueAsString(parts));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to build cache key for request", e);
        }
    }

    private static String format(Instant instant) {
        return TIME_FORMAT.format(instant);
    }

    private static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 规范化文本，用于日志排查
     */
    public String canonical() {
        return canonical;
    }

    /**
     * L1 与 L2 使用相同格式: bi:agg:{sha256}
     */
    public String toL1Key() {
        return PREFIX + digest;
    }

    public String toL2Key() {
        return toL1Key();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return digest.equals(((CacheKey) o).digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    @Override
    public String toString() {
        return toL1Key();
    }
}
