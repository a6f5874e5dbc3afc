package com.asiainfo.analytics.core.engine;

import com.asiainfo.analytics.common.exception.CriticalPathTimeoutException;
import com.asiainfo.analytics.common.exception.DataStoreException;
import com.asiainfo.analytics.config.EngineConfig;
import com.asiainfo.analytics.core.comparison.ComparisonEngine;
import com.asiainfo.analytics.core.insight.InsightEngine;
import com.asiainfo.analytics.core.model.AggregationRequest;
import com.asiainfo.analytics.core.model.AggregationResult;
import com.asiainfo.analytics.core.model.Comparison;
import com.asiainfo.analytics.core.model.Insight;
import com.asiainfo.analytics.core.model.ResultRow;
import com.asiainfo.analytics.core.model.SummaryStatistics;
import com.asiainfo.analytics.core.stats.StatisticsEngine;
import com.asiainfo.analytics.infra.cache.CacheManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 聚合引擎入口
 * 流程：校验 -> 缓存 -> 查询（可并发查询上一窗口） -> 统计 -> 洞察 -> 环比 -> 回写缓存
 * 关键路径请求在独立线程执行并限时，超时即取消并抛出 CriticalPathTimeoutException
 */
@ApplicationScoped
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final RequestValidator validator;
    private final CriticalPathClassifier classifier;
    private final AggregationExecutor executor;
    private final CacheManager cacheManager;
    private final StatisticsEngine statisticsEngine;
    private final InsightEngine insightEngine;
    private final ComparisonEngine comparisonEngine;
    private final EngineConfig config;
    private final ExecutorService criticalPool;
    private final ExecutorService comparisonPool;
    private final MeterRegistry registry;
    private final Clock clock;

    @Inject
    public AggregationEngine(RequestValidator validator,
                             CriticalPathClassifier classifier,
                             AggregationExecutor executor,
                             CacheManager cacheManager,
                             StatisticsEngine statisticsEngine,
                             InsightEngine insightEngine,
                             ComparisonEngine comparisonEngine,
                             EngineConfig config,
                             @Named("criticalExecutor") ExecutorService criticalPool,
                             @Named("comparisonExecutor") ExecutorService comparisonPool,
                             MeterRegistry registry,
                             Clock clock) {
        this.validator = validator;
        this.classifier = classifier;
        this.executor = executor;
        this.cacheManager = cacheManager;
        this.statisticsEngine = statisticsEngine;
        this.insightEngine = insightEngine;
        this.comparisonEngine = comparisonEngine;
        this.config = config;
        this.criticalPool = criticalPool;
        this.comparisonPool = comparisonPool;
        this.registry = registry;
        this.clock = clock;
    }

    public AggregationResult aggregate(AggregationRequest request) {
        validator.validate(request);
        boolean critical = classifier.isCritical(request);

        Timer.Sample sample = Timer.start(registry);
        try {
            return critical ? runWithDeadline(request) : performAggregation(request);
        } finally {
            sample.stop(registry.timer("bi.aggregation.duration", "critical", String.valueOf(critical)));
        }
    }

    private AggregationResult runWithDeadline(AggregationRequest request) {
        long deadlineMs = config.getCriticalDeadlineMs();
        Future<AggregationResult> future = criticalPool.submit(() -> performAggregation(request));
        try {
            return future.get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 取消并中断执行线程，迟到的结果直接丢弃
            future.cancel(true);
            registry.counter("bi.aggregation.timeouts").increment();
            log.warn("[Engine] Critical aggregation exceeded {}ms: dimensions={} measures={}",
                    deadlineMs, request.dimensions(), request.measures());
            throw new CriticalPathTimeoutException(deadlineMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for critical aggregation");
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    AggregationResult performAggregation(AggregationRequest request) {
        // 1. 缓存
        Optional<AggregationResult> cached = cacheManager.get(request);
        if (cached.isPresent()) {
            log.debug("[Engine] Served from cache: dimensions={} measures={}",
                    request.dimensions(), request.measures());
            return cached.get();
        }

        // 2. 上一窗口与当前窗口并发查询
        Future<List<ResultRow>> previousFuture = null;
        if (request.includeComparisons()) {
            AggregationRequest previousRequest = request.withDateRange(comparisonEngine.previousWindow(request));
            previousFuture = comparisonPool.submit(() -> executor.execute(previousRequest));
        }

        boolean completed = false;
        try {
            List<ResultRow> rows = executeLogged(request);

            // 3. 统计与洞察
            SummaryStatistics stats = statisticsEngine.calculate(rows, request);
            List<Insight> insights = insightEngine.generate(rows, request);

            // 4. 环比
            Comparison comparison = null;
            if (previousFuture != null) {
                List<ResultRow> previousRows = awaitPrevious(previousFuture, request);
                comparison = comparisonEngine.compare(request, rows, previousRows);
            }

            AggregationResult result = new AggregationResult(
                    "agg_" + UUID.randomUUID(),
                    clock.instant(),
                    request,
                    rows,
                    stats,
                    comparison,
                    insights);

            // 超时取消后才完成的结果不写缓存
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Aggregation cancelled before caching");
            }
            cacheManager.put(request, result);
            completed = true;
            log.info("[Engine] Aggregated {} rows, {} insights: dimensions={} measures={}",
                    rows.size(), insights.size(), request.dimensions(), request.measures());
            return result;
        } finally {
            if (!completed && previousFuture != null) {
                previousFuture.cancel(true);
            }
        }
    }

    private List<ResultRow> executeLogged(AggregationRequest request) {
        try {
            return executor.execute(request);
        } catch (DataStoreException e) {
            log.error("[Engine] Aggregation query failed for request {}", request, e);
            throw e;
        }
    }

    private List<ResultRow> awaitPrevious(Future<List<ResultRow>> future, AggregationRequest request) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for previous window");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof DataStoreException) {
                log.error("[Engine] Previous window query failed for request {}", request, e.getCause());
            }
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException("Aggregation failed", cause);
    }
}
