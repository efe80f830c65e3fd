package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.exception.RebalanceBusyException;
import com.seederr.tiering.exception.StoreUnavailableException;
import com.seederr.tiering.model.CycleReport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 调度线程
 *
 * 单线程执行器，上一轮结束后间隔 check-interval 再开始下一轮，各轮严格串行。
 * 管理接口的手动触发和预览也提交到同一线程。
 */
@Slf4j
@Component
public class RebalanceScheduler {

    private final RebalanceCycleOrchestrator orchestrator;
    private final MetricStore metricStore;
    private final CancellationSignal cancellation;
    private final SeederrProperties properties;

    private final ScheduledExecutorService worker = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "rebalance-worker");
        t.setDaemon(true);
        return t;
    });

    public RebalanceScheduler(RebalanceCycleOrchestrator orchestrator,
                              MetricStore metricStore,
                              CancellationSignal cancellation,
                              SeederrProperties properties) {
        this.orchestrator = orchestrator;
        this.metricStore = metricStore;
        this.cancellation = cancellation;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        SeederrProperties.Rebalance rebalance = properties.getRebalance();

        try {
            long records = metricStore.count();
            log.info("Metrics store reachable, {} metric records loaded", records);
        } catch (StoreUnavailableException e) {
            log.error("Metrics store unavailable at startup: {}", e.getMessage());
            throw e;
        }

        if (rebalance.isDryRun()) {
            log.warn("==================================================");
            log.warn("{} Dry-run mode is enabled: no files will be copied, deleted or repointed",
                TieringConstants.DRY_RUN_MARKER);
            log.warn("==================================================");
        }

        if (!rebalance.isSchedulerEnabled()) {
            log.info("Rebalance scheduler disabled, cycles run only on manual trigger");
            return;
        }

        worker.scheduleWithFixedDelay(this::tick,
            rebalance.getInitialDelay().toMillis(),
            rebalance.getCheckInterval().toMillis(),
            TimeUnit.MILLISECONDS);
        log.info("Rebalance scheduler started: first cycle in {}s, then every {}s after the previous one ends",
            rebalance.getInitialDelay().toSeconds(), rebalance.getCheckInterval().toSeconds());
    }

    /**
     * 立即排队执行一轮，当前轮次执行中时排在其后
     */
    public void triggerNow() {
        log.info("Manual rebalance cycle requested");
        worker.execute(this::tick);
    }

    /**
     * 在调度线程上计算预览方案
     *
     * @throws RebalanceBusyException 等待超时（通常是有一轮正在迁移大文件）
     */
    public CycleReport preview() {
        Duration timeout = properties.getRebalance().getPreviewTimeout();
        Future<CycleReport> future = worker.submit(orchestrator::preview);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new RebalanceBusyException("Rebalance worker did not produce a preview within " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebalanceBusyException("Interrupted while waiting for preview", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Preview failed", e.getCause());
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping rebalance scheduler");
        cancellation.cancel();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Rebalance worker did not stop within 30s, forcing shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        if (cancellation.isCancelled()) {
            return;
        }
        try {
            orchestrator.runCycle();
        } catch (RuntimeException e) {
            log.error("Unexpected error in rebalance cycle: {}", e.getMessage(), e);
        }
    }
}
