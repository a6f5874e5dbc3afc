package com.asiainfo.analytics.infra.cache.l1;

import com.asiainfo.analytics.core.model.AggregationResult;
import com.asiainfo.analytics.infra.cache.CacheConfig;
import com.asiainfo.analytics.infra.cache.CacheEntry;
import com.asiainfo.analytics.support.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class L1CaffeineCacheTest {

    private ManualTicker ticker;
    private L1CaffeineCache cache;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        Clock clock = Clock.fixed(Instant.parse("2024-03-04T00:00:00Z"), ZoneOffset.UTC);
        cache = new L1CaffeineCache(CacheConfig.of(true, 30, 100, 5, false, 15), ticker, clock);
    }

    private static AggregationResult result(String id) {
        return new AggregationResult(id, Instant.EPOCH, null, List.of(), null, null, List.of());
    }

    @Test
    void testHitIncrementsAccessCount() {
        cache.put("k1", result("r1"));

        assertEquals(0, cache.peek("k1").orElseThrow().getAccessCount());

        Optional<CacheEntry> first = cache.get("k1");
        Optional<CacheEntry> second = cache.get("k1");

        assertTrue(first.isPresent());
        assertEquals("r1", second.orElseThrow().getPayload().id());
        assertEquals(2, cache.peek("k1").orElseThrow().getAccessCount());
        assertEquals(Instant.parse("2024-03-04T00:00:00Z"), second.get().getInsertedAt());
    }

    @Test
    void testEntryExpiresAfterTtl() {
        cache.put("k1", result("r1"));

        ticker.advance(Duration.ofMinutes(29));
        assertTrue(cache.get("k1").isPresent());

        ticker.advance(Duration.ofMinutes(2));
        assertTrue(cache.get("k1").isEmpty());
    }

    @Test
    void testSweepRemovesExpiredEntries() {
        cache.put("old", result("old"));
        ticker.advance(Duration.ofMinutes(20));
        cache.put("fresh", result("fresh"));
        ticker.advance(Duration.ofMinutes(15));

        cache.sweep();

        assertEquals(1, cache.size());
        assertTrue(cache.peek("fresh").isPresent());
        assertTrue(cache.peek("old").isEmpty());
    }

    @Test
    void testSweepEvictsLeastAccessedFirst() {
        for (int i = 0; i < 120; i++) {
            cache.put("k" + i, result("r" + i));
        }
        // 前 100 个条目访问 i%5+1 次，最后 20 个不访问
        for (int i = 0; i < 100; i++) {
            for (int n = 0; n <= i % 5; n++) {
                cache.get("k" + i);
            }
        }

        int evicted = cache.sweep();

        assertEquals(20, evicted);
        assertEquals(100, cache.size());
        for (int i = 100; i < 120; i++) {
            assertTrue(cache.peek("k" + i).isEmpty(), "never accessed entry should be evicted: k" + i);
        }
        for (int i = 0; i < 100; i++) {
            assertTrue(cache.peek("k" + i).isPresent());
        }
    }

    @Test
    void testSweepWithinCapacityIsNoop() {
        cache.put("k1", result("r1"));
        assertEquals(0, cache.sweep());
        assertEquals(1, cache.size());
    }

    @Test
    void testPutOverwriteResetsAccessCount() {
        cache.put("k1", result("r1"));
        cache.get("k1");
        cache.put("k1", result("r2"));

        CacheEntry entry = cache.peek("k1").orElseThrow();
        assertEquals(0, entry.getAccessCount());
        assertEquals("r2", entry.getPayload().id());
    }
}
