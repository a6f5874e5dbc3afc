package com.asiainfo.analytics.infra.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheSweeperTest {

    @Mock
    CacheManager cacheManager;

    @Test
    void testStartAndStop() {
        CacheSweeper sweeper = new CacheSweeper(cacheManager, CacheConfig.defaults());

        sweeper.start();
        sweeper.start(); // 重复启动无副作用
        assertTrue(sweeper.isRunning());

        sweeper.stop();
        assertFalse(sweeper.isRunning());
        sweeper.stop();
    }

    @Test
    void testSweepFailureIsContained() {
        CacheSweeper sweeper = new CacheSweeper(cacheManager, CacheConfig.defaults());
        when(cacheManager.sweep()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(sweeper::runSweep);
        verify(cacheManager).sweep();
    }
}
