package com.asiainfo.analytics.application.etl;

import com.asiainfo.analytics.common.exception.ValidationException;
import com.asiainfo.analytics.common.exception.ValidationException.FieldError;
import com.asiainfo.analytics.config.EtlConfig;
import com.asiainfo.analytics.core.model.etl.EtlMonitoring;
import com.asiainfo.analytics.core.model.etl.EtlOperation;
import com.asiainfo.analytics.core.model.etl.EtlOperation.ProcessingMode;
import com.asiainfo.analytics.core.model.etl.EtlOperation.SourceType;
import com.asiainfo.analytics.core.model.etl.EtlProcess;
import com.asiainfo.analytics.core.model.etl.EtlStatus;
import com.asiainfo.analytics.core.model.etl.QualityRule;
import com.asiainfo.analytics.core.model.etl.QualityRule.RuleStatus;
import com.asiainfo.analytics.core.model.etl.QualityTrend;
import com.asiainfo.analytics.core.model.etl.TransformationStep;
import com.asiainfo.analytics.infra.metadata.MetadataRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * ETL 模拟执行与数据质量评分
 * 按步骤模拟记录量，每步后用通过率评估质量规则：
 * REJECT 规则违规则中止后续步骤，FIX 规则违规则修复本步拒绝记录，WARN 规则违规则标记告警
 * 任何时刻 inserted + rejected == processed
 */
@ApplicationScoped
public class EtlSimulator {

    private static final Logger log = LoggerFactory.getLogger(EtlSimulator.class);

    private final MetadataRepository repository;
    private final EtlTrendPolicy trendPolicy;
    private final EtlConfig config;
    private final Random random;
    private final Clock clock;
    private final MeterRegistry registry;

    @Inject
    public EtlSimulator(MetadataRepository repository, EtlTrendPolicy trendPolicy, EtlConfig config,
                        Random random, Clock clock, MeterRegistry registry) {
        this.repository = repository;
        this.trendPolicy = trendPolicy;
        this.config = config;
        this.random = random;
        this.clock = clock;
        this.registry = registry;
    }

    /**
     * 运行参数
     *
     * @param qualityRules 覆盖流程自带的质量规则，为空时使用流程配置
     * @param processId    为空时使用默认流程
     */
    public record EtlCommand(
            String operation,
            String sourceType,
            String processingMode,
            List<QualityRule> qualityRules,
            String processId) {

        public static EtlCommand of(String operation, String sourceType, String processingMode) {
            return new EtlCommand(operation, sourceType, processingMode, null, null);
        }
    }

    public EtlProcess processEtl(EtlCommand command) {
        // 1. 参数校验
        List<FieldError> errors = new ArrayList<>();
        EtlOperation operation = EtlOperation.fromCode(command.operation());
        if (operation == null) {
            errors.add(new FieldError("operation", "Unsupported operation: " + command.operation()));
        }
        SourceType sourceType = SourceType.fromCode(command.sourceType());
        if (sourceType == null) {
            errors.add(new FieldError("sourceType", "Unsupported source type: " + command.sourceType()));
        }
        ProcessingMode mode = command.processingMode() == null || command.processingMode().isBlank()
                ? ProcessingMode.BATCH
                : ProcessingMode.fromCode(command.processingMode());
        if (mode == null) {
            errors.add(new FieldError("processingMode", "Unsupported processing mode: " + command.processingMode()));
        }
        List<QualityRule> overrides = command.qualityRules();
        if (overrides != null) {
            for (int i = 0; i < overrides.size(); i++) {
                validateRule(overrides.get(i), i, errors);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        String processId = command.processId() == null || command.processId().isBlank()
                ? config.getDefaultProcessId()
                : command.processId();
        EtlProcess process = repository.etlProcess(processId);
        List<QualityRule> baseRules = overrides != null && !overrides.isEmpty()
                ? overrides
                : process.dataQuality() == null ? List.of() : process.dataQuality().rules();

        String runId = operation.code() + "_" + sourceType.code() + "_" + clock.millis();
        log.info("[ETL] Starting run {}: process={}, mode={}", runId, processId, mode.code());

        // 2. 逐步执行
        RunState state = new RunState(baseRules);
        long startNanos = System.nanoTime();
        List<TransformationStep> steps = new ArrayList<>(process.transformations());
        steps.sort(Comparator.comparingInt(TransformationStep::step));

        for (TransformationStep step : steps) {
            boolean abort = runStep(step, state);
            state.completedSteps++;
            if (abort) {
                log.warn("[ETL] Run {} aborted at step {} by reject rule", runId, step.step());
                break;
            }
            pause();
        }

        // 3. 汇总
        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        double throughput = elapsedSeconds > 0 ? state.processed / elapsedSeconds : 0;
        double errorRate = state.processed > 0 ? state.rejected * 100.0 / state.processed : 0;
        double overallScore = 100 - errorRate;
        long updated = (long) Math.floor(state.inserted * config.getUpdatedRatio());

        EtlMonitoring monitoring = new EtlMonitoring(
                runId,
                operation.code(),
                sourceType.code(),
                mode.code(),
                state.status,
                clock.instant(),
                elapsedSeconds,
                state.completedSteps,
                state.processed,
                state.inserted,
                updated,
                state.rejected,
                errorRate,
                throughput,
                memoryUsageMb(),
                cpuUsage());

        QualityTrend trend = trendPolicy.trend(process, overallScore);
        EtlProcess snapshot = process.withRun(monitoring,
                new EtlProcess.DataQuality(state.finalRules(), overallScore, trend));
        repository.saveEtlProcess(snapshot);

        registry.counter("bi.etl.runs", "status", state.status.name()).increment();
        log.info("[ETL] Run {} finished: status={}, processed={}, inserted={}, rejected={}, score={}, trend={}",
                runId, state.status, state.processed, state.inserted, state.rejected,
                String.format("%.2f", overallScore), trend);
        return snapshot;
    }

    /**
     * 最近一次运行快照，processId 为空时返回全部流程
     */
    public List<EtlProcess> etlStatus(String processId) {
        if (processId == null || processId.isBlank()) {
            return repository.etlProcesses();
        }
        return List.of(repository.etlProcess(processId));
    }

    /**
     * @return 是否因 REJECT 规则中止
     */
    private boolean runStep(TransformationStep step, RunState state) {
        int min = config.getMinStepRecords();
        int max = Math.max(min, config.getMaxStepRecords());
        long volume = min + random.nextInt(max - min + 1);
        long stepRejected = (long) Math.floor(volume * step.rejectionRate());
        double passRate = volume > 0 ? (volume - stepRejected) * 100.0 / volume : 100.0;

        boolean reject = false;
        boolean fix = false;
        boolean warn = false;
        for (int i = 0; i < state.rules.size(); i++) {
            QualityRule rule = state.rules.get(i);
            if (passRate >= rule.threshold()) {
                continue;
            }
            state.violations[i] += stepRejected;
            switch (rule.action()) {
                case REJECT -> {
                    reject = true;
                    state.statuses[i] = RuleStatus.FAILED;
                }
                case FIX -> {
                    fix = true;
                    state.escalate(i, RuleStatus.WARNING);
                }
                case WARN -> {
                    warn = true;
                    state.escalate(i, RuleStatus.WARNING);
                }
            }
        }

        long effectiveRejected = stepRejected;
        if (reject) {
            state.status = EtlStatus.FAILED;
        } else {
            if (fix) {
                // 本步拒绝的记录修复后入库
                effectiveRejected = 0;
            }
            if (warn && state.status == EtlStatus.SUCCESS) {
                state.status = EtlStatus.WARNING;
            }
        }

        state.processed += volume;
        state.inserted += volume - effectiveRejected;
        state.rejected += effectiveRejected;

        log.debug("[ETL] Step {} ({}): volume={}, rejected={}, passRate={}",
                step.step(), step.kind(), volume, effectiveRejected, String.format("%.2f", passRate));
        return reject;
    }

    private void pause() {
        long delay = config.getStepDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("ETL run interrupted");
        }
    }

    private static void validateRule(QualityRule rule, int index, List<FieldError> errors) {
        String prefix = "qualityRules[" + index + "]";
        if (rule == null) {
            errors.add(new FieldError(prefix, "Rule must not be null"));
            return;
        }
        if (rule.id() == null || rule.id().isBlank()) {
            errors.add(new FieldError(prefix + ".id", "Rule id is required"));
        }
        if (rule.action() == null) {
            errors.add(new FieldError(prefix + ".action", "Rule action is required"));
        }
        if (rule.threshold() < 0 || rule.threshold() > 100) {
            errors.add(new FieldError(prefix + ".threshold", "Threshold must be within [0, 100]"));
        }
    }

    private static double memoryUsageMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
    }

    private static double cpuUsage() {
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return load < 0 ? 0 : load;
    }

    /**
     * 单次运行的累计状态
     */
    private static final class RunState {
        final List<QualityRule> rules;
        final long[] violations;
        final RuleStatus[] statuses;
        EtlStatus status = EtlStatus.SUCCESS;
        long processed;
        long inserted;
        long rejected;
        int completedSteps;

        RunState(List<QualityRule> baseRules) {
            this.rules = baseRules.stream().map(QualityRule::reset).toList();
            this.violations = new long[rules.size()];
            this.statuses = new RuleStatus[rules.size()];
            Arrays.fill(statuses, RuleStatus.PASSED);
        }

        void escalate(int i, RuleStatus status) {
            if (statuses[i].ordinal() < status.ordinal()) {
                statuses[i] = status;
            }
        }

        List<QualityRule> finalRules() {
            List<QualityRule> result = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                result.add(rules.get(i).withResult(statuses[i], violations[i]));
            }
            return result;
        }
    }
}
