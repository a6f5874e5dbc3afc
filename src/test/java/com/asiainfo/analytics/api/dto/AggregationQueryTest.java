package com.asiainfo.analytics.api.dto;

import com.asiainfo.analytics.api.dto.AggregationQuery.QueryDateRange;
import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.core.model.AggregationKind;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.TimeGranularity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregationQueryTest {

    @Test
    void testDefaults() {
        AggregationQuery query = new AggregationQuery(List.of("time"), List.of("revenue"), null,
                new QueryDateRange("2024-03-04", "2024-03-11T12:00:00Z"), null, null, null, null);

        AggregationRequest request = query.toRequest();

        assertEquals(TimeGranularity.DAY, request.timeGranularity());
        assertEquals(AggregationKind.SUM, request.aggregationKind());
        assertTrue(request.includeComparisons());
        assertFalse(request.includeForecasts());
        assertEquals(Instant.parse("2024-03-04T00:00:00Z"), request.dateRange().start());
        assertEquals(Instant.parse("2024-03-11T12:00:00Z"), request.dateRange().end());
        assertTrue(request.filters().isEmpty());
    }

    @Test
    void testExplicitValues() {
        AggregationQuery query = new AggregationQuery(List.of("tenant"), List.of("orders"), "Month",
                new QueryDateRange("2024-01-01", "2024-04-01"), Map.of("region", "north"), "avg", false, true);

        AggregationRequest request = query.toRequest();

        assertEquals(TimeGranularity.MONTH, request.timeGranularity());
        assertEquals(AggregationKind.AVG, request.aggregationKind());
        assertFalse(request.includeComparisons());
        assertTrue(request.includeForecasts());
        assertEquals("north", request.filters().get("region"));
    }

    @Test
    void testMalformedFieldsCollected() {
        AggregationQuery query = new AggregationQuery(List.of("time"), List.of("revenue"), "fortnight",
                new QueryDateRange("04/03/2024", null), null, "median", null, null);

        ValidationException e = assertThrows(ValidationException.class, query::toRequest);

        assertEquals(List.of("timeGranularity", "aggregationType", "dateRange.startDate", "dateRange.endDate"),
                e.getErrors().stream().map(ValidationException.FieldError::field).toList());
    }

    @Test
    void testMissingDateRange() {
        AggregationQuery query = new AggregationQuery(List.of(), List.of("revenue"), null, null, null, null, null, null);

        ValidationException e = assertThrows(ValidationException.class, query::toRequest);
        assertEquals("dateRange", e.getErrors().get(0).field());
    }

    @Test
    void testDeserializeRequestBody() throws Exception {
        String json = """
                {
                  "dimensions": ["time", "tenant"],
                  "measures": ["revenue", "orders"],
                  "timeGranularity": "week",
                  "dateRange": {"startDate": "2024-03-04", "endDate": "2024-03-11"},
                  "filters": {"minAmount": 100, "tenantId": "t1"},
                  "includeComparisons": false
                }
                """;

        AggregationQuery query = new ObjectMapper().readValue(json, AggregationQuery.class);
        AggregationRequest request = query.toRequest();

        assertEquals(List.of("time", "tenant"), request.dimensions());
        assertEquals(TimeGranularity.WEEK, request.timeGranularity());
        assertEquals(100, request.filters().get("minAmount"));
        assertFalse(request.includeComparisons());
    }
}
