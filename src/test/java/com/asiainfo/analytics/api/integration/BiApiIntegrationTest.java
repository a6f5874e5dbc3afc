package com.asiainfo.analytics.api.integration;

import com.asiainfo.analytics.infra.cache.CacheManager;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 启动完整应用的 API 冒烟测试
 * test profile 下关闭 L2，数据源指向 target 目录下的 SQLite 文件
 */
@QuarkusTest
@DisplayName("BI API Integration Tests")
class BiApiIntegrationTest {

    @Inject
    CacheManager cacheManager;

    @Test
    @DisplayName("Should wire cache from test profile")
    void testCacheWiring() {
        assertTrue(cacheManager.getStats().l1Enabled());
        assertFalse(cacheManager.getStats().l2Enabled());

        given()
                .when()
                .get("/api/v1/bi/cache/stats")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("data.l2Enabled", equalTo(false));
    }

    @Test
    @DisplayName("Should list registered cubes")
    void testCubes() {
        given()
                .when()
                .get("/api/v1/bi/cubes")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("data.id", hasItems("revenue_analytics", "operational_analytics"));

        given()
                .queryParam("cubeId", "nonexistent_cube")
                .when()
                .get("/api/v1/bi/cube")
                .then()
                .statusCode(200)
                .body("status", equalTo("1004"))
                .body("data", nullValue());
    }

    @Test
    @DisplayName("Should resolve cube lineage")
    void testLineage() {
        given()
                .queryParam("entityId", "revenue_analytics")
                .queryParam("entityType", "cube")
                .when()
                .get("/api/v1/bi/lineage")
                .then()
                .statusCode(200)
                .body("status", equalTo("0000"))
                .body("data.entityId", equalTo("revenue_analytics"))
                .body("data.upstream.entityId", hasItem("payments_table"));
    }

    @Test
    @DisplayName("Should reject unknown dimension before querying")
    void testAggregateValidation() {
        String body = """
                {
                  "dimensions": ["galaxy"],
                  "measures": ["revenue"],
                  "dateRange": {"startDate": "2024-03-04", "endDate": "2024-03-11"}
                }
                """;

        given()
                .contentType(ContentType.JSON)
                .body(body)
                .when()
                .post("/api/v1/bi/aggregate")
                .then()
                .statusCode(200)
                .body("status", equalTo("1001"))
                .body("msg", containsString("galaxy"));
    }
}
