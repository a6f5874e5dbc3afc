package com.asiainfo.analytics.core.model;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TimeGranularityTest {

    private static final DateTimeFormatter DB_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @Test
    void testBucketFormats() {
        Instant t = Instant.parse("2024-05-17T13:45:00Z");

        assertEquals("2024-05-17-13", TimeGranularity.HOUR.bucket(t));
        assertEquals("2024-05-17", TimeGranularity.DAY.bucket(t));
        assertEquals("2024-05", TimeGranularity.MONTH.bucket(t));
        assertEquals("2024-Q2", TimeGranularity.QUARTER.bucket(t));
        assertEquals("2024", TimeGranularity.YEAR.bucket(t));
    }

    @Test
    void testWeekIsMondayBased() {
        // 2024-01-01 是周一，属于第 01 周；2023-01-01 是周日，属于第 00 周
        assertEquals("2024-01", TimeGranularity.WEEK.bucket(Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals("2024-01", TimeGranularity.WEEK.bucket(Instant.parse("2024-01-07T23:00:00Z")));
        assertEquals("2024-02", TimeGranularity.WEEK.bucket(Instant.parse("2024-01-08T00:00:00Z")));
        assertEquals("2023-00", TimeGranularity.WEEK.bucket(Instant.parse("2023-01-01T12:00:00Z")));
    }

    @Test
    void testJavaBucketMatchesSqlite() throws Exception {
        Random random = new Random(42);
        Instant base = Instant.parse("2020-01-01T00:00:00Z");
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite::memory:")) {
            for (TimeGranularity g : TimeGranularity.values()) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT " + g.sqlExpression("c") + " FROM (SELECT ? AS c)")) {
                    for (int i = 0; i < 200; i++) {
                        Instant t = base.plus(Duration.ofMinutes(random.nextInt(6 * 365 * 24 * 60)));
                        ps.setString(1, DB_FORMAT.format(t));
                        try (ResultSet rs = ps.executeQuery()) {
                            assertTrue(rs.next());
                            assertEquals(rs.getString(1), g.bucket(t), g + " bucket mismatch for " + t);
                        }
                    }
                }
            }
        }
    }

    @Test
    void testFromCode() {
        assertEquals(TimeGranularity.DAY, TimeGranularity.fromCode("day"));
        assertEquals(TimeGranularity.QUARTER, TimeGranularity.fromCode(" Quarter "));
        assertNull(TimeGranularity.fromCode("fortnight"));
        assertNull(TimeGranularity.fromCode(null));
    }
}
