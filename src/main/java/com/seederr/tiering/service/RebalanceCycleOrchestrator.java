package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.exception.SourceUnavailableException;
import com.seederr.tiering.exception.StoreUnavailableException;
import com.seederr.tiering.model.CycleOutcome;
import com.seederr.tiering.model.CycleReport;
import com.seederr.tiering.model.CycleState;
import com.seederr.tiering.model.MetricRecord;
import com.seederr.tiering.model.OperationStatus;
import com.seederr.tiering.model.PayloadSnapshot;
import com.seederr.tiering.model.PlacementPlan;
import com.seederr.tiering.model.RelocationOperation;
import com.seederr.tiering.model.ScoredPayload;
import com.seederr.tiering.model.Tier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单轮调度编排
 *
 * FETCH → SCORE → PLAN → RECONCILE → EXECUTE → PERSIST → IDLE
 *
 * <ul>
 *   <li>FETCH 失败：本轮结束，不读写指标存储，不产生任何操作</li>
 *   <li>SCORE 读取历史失败：全部按冷启动评分，并跳过本轮 PERSIST，避免覆盖历史</li>
 *   <li>PERSIST 失败：只记录在报告里，已完成的迁移不回滚</li>
 * </ul>
 *
 * 只允许在单个调度线程上调用。
 */
@Slf4j
@Service
public class RebalanceCycleOrchestrator {

    private final TorrentSource torrentSource;
    private final MetricStore metricStore;
    private final StorageStatProvider storageStats;
    private final PayloadScorer scorer;
    private final CapacityPlanner planner;
    private final OrphanCacheDetector orphanDetector;
    private final PlacementReconciler reconciler;
    private final RelocationExecutor executor;
    private final UploadRateTracker rateTracker;
    private final CancellationSignal cancellation;
    private final SeederrProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicLong cycleIds = new AtomicLong();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private volatile CycleState state = CycleState.IDLE;

    public RebalanceCycleOrchestrator(TorrentSource torrentSource,
                                      MetricStore metricStore,
                                      StorageStatProvider storageStats,
                                      PayloadScorer scorer,
                                      CapacityPlanner planner,
                                      OrphanCacheDetector orphanDetector,
                                      PlacementReconciler reconciler,
                                      RelocationExecutor executor,
                                      UploadRateTracker rateTracker,
                                      CancellationSignal cancellation,
                                      SeederrProperties properties,
                                      MeterRegistry meterRegistry) {
        this.torrentSource = torrentSource;
        this.metricStore = metricStore;
        this.storageStats = storageStats;
        this.scorer = scorer;
        this.planner = planner;
        this.orphanDetector = orphanDetector;
        this.reconciler = reconciler;
        this.executor = executor;
        this.rateTracker = rateTracker;
        this.cancellation = cancellation;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 执行完整一轮调度，dry-run 取自配置
     */
    public CycleReport runCycle() {
        CycleReport report = run(properties.getRebalance().isDryRun(), false);
        lastReport.set(report);
        return report;
    }

    /**
     * 只计算方案：不执行迁移，不写指标存储
     */
    public CycleReport preview() {
        return run(true, true);
    }

    public CycleState getState() {
        return state;
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private CycleReport run(boolean dryRun, boolean preview) {
        long cycleId = cycleIds.incrementAndGet();
        Instant startedAt = Instant.now();
        Timer.Sample sample = Timer.start(meterRegistry);
        SeederrProperties.Rebalance rebalance = properties.getRebalance();

        CycleReport.CycleReportBuilder report = CycleReport.builder()
            .cycleId(cycleId)
            .startedAt(startedAt)
            .dryRun(dryRun)
            .preview(preview);

        log.info("=== Starting {} #{}{} ===", preview ? "preview" : "rebalance cycle", cycleId,
            dryRun ? " " + TieringConstants.DRY_RUN_MARKER : "");

        try {
            // FETCH
            state = CycleState.FETCH;
            List<PayloadSnapshot> payloads;
            try {
                payloads = torrentSource.listPayloads();
            } catch (SourceUnavailableException e) {
                log.error("Could not fetch torrents from client, skipping cycle #{}: {}", cycleId, e.getMessage());
                return finish(report.outcome(CycleOutcome.SOURCE_UNAVAILABLE).message(e.getMessage()), sample);
            }
            report.payloadCount(payloads.size());
            if (cancellation.isCancelled()) {
                return finish(report.outcome(CycleOutcome.CANCELLED).message("cancelled after fetch"), sample);
            }

            // SCORE
            state = CycleState.SCORE;
            Map<String, MetricRecord> history;
            boolean historyAvailable = true;
            try {
                history = metricStore.getAll(payloads.stream().map(PayloadSnapshot::getHash).toList());
            } catch (StoreUnavailableException e) {
                log.warn("Metrics store unavailable, using cold-start scores and skipping persist this cycle: {}",
                    e.getMessage());
                history = Map.of();
                historyAvailable = false;
            }
            Map<String, MetricRecord> metrics = history;
            List<ScoredPayload> scored = payloads.stream()
                .map(p -> scorer.scored(p, metrics.get(p.getHash())))
                .toList();

            // PLAN
            state = CycleState.PLAN;
            long capacity = storageStats.capacityBytes(Tier.CACHE);
            long used = storageStats.usedBytes(Tier.CACHE);
            PlacementPlan plan = planner.plan(scored, capacity, rebalance.getTargetFillPercent());
            report.cacheCapacityBytes(capacity)
                .cacheUsedBytes(used)
                .cacheBudgetBytes(plan.budgetBytes())
                .plannedCacheBytes(plan.plannedCacheBytes());

            // RECONCILE
            state = CycleState.RECONCILE;
            List<RelocationOperation> cleanups = orphanDetector.detect(scored, plan);
            PlacementReconciler.Result reconciled = reconciler.reconcile(
                scored, plan, cleanups, rebalance.getMaxOperationsPerCycle());
            report.requiredOperations(reconciled.required().size())
                .operations(reconciled.selected());

            if (preview) {
                return finish(report.outcome(CycleOutcome.COMPLETED), sample);
            }

            // EXECUTE
            state = CycleState.EXECUTE;
            List<RelocationOperation> executed = new ArrayList<>();
            for (RelocationOperation op : reconciled.selected()) {
                if (cancellation.isCancelled()) {
                    log.warn("Shutdown requested, leaving {} operation(s) unstarted",
                        reconciled.selected().size() - executed.size());
                    break;
                }
                executor.execute(op, dryRun);
                executed.add(op);
            }
            if (cancellation.isCancelled()) {
                return finish(report.outcome(CycleOutcome.CANCELLED).message("cancelled during execute"), sample);
            }

            // PERSIST
            state = CycleState.PERSIST;
            if (historyAvailable) {
                report.persisted(persist(payloads, metrics));
            } else {
                report.message("metrics store unavailable, history not updated");
            }

            return finish(report.outcome(CycleOutcome.COMPLETED), sample);
        } catch (RuntimeException e) {
            log.error("Rebalance cycle #{} failed in state {}: {}", cycleId, state, e.getMessage(), e);
            return finish(report.outcome(CycleOutcome.FAILED).message(e.getMessage()), sample);
        } finally {
            state = CycleState.IDLE;
        }
    }

    private boolean persist(List<PayloadSnapshot> payloads, Map<String, MetricRecord> history) {
        Instant now = Instant.now();
        List<MetricRecord> updated = payloads.stream()
            .map(p -> rateTracker.observe(p, history.get(p.getHash()), now))
            .toList();
        try {
            metricStore.upsertAll(updated);
            metricStore.pruneNotSeenSince(now.minus(properties.getMetricsStore().getStaleGracePeriod()));
            return true;
        } catch (StoreUnavailableException e) {
            log.error("Failed to persist metrics for {} payloads: {}", updated.size(), e.getMessage(), e);
            return false;
        }
    }

    private CycleReport finish(CycleReport.CycleReportBuilder builder, Timer.Sample sample) {
        CycleReport report = builder.finishedAt(Instant.now()).build();
        String outcome = report.getOutcome().name();

        sample.stop(Timer.builder(TieringConstants.METRIC_CYCLE_DURATION)
            .description("Rebalance cycle duration")
            .tag("outcome", outcome)
            .tag("preview", String.valueOf(report.isPreview()))
            .register(meterRegistry));
        meterRegistry.counter(TieringConstants.METRIC_CYCLES,
            "outcome", outcome, "preview", String.valueOf(report.isPreview())).increment();

        log.info("=== Cycle #{} finished: outcome={}, payloads={}, required={}, selected={}, completed={}, failed={} ===",
            report.getCycleId(), outcome, report.getPayloadCount(), report.getRequiredOperations(),
            report.getOperations().size(),
            report.countByStatus(OperationStatus.COMPLETED),
            report.countByStatus(OperationStatus.FAILED));
        return report;
    }
}
