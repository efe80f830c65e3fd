package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.exception.SourceUnavailableException;
import com.seederr.tiering.exception.StoreUnavailableException;
import com.seederr.tiering.model.CycleOutcome;
import com.seederr.tiering.model.CycleReport;
import com.seederr.tiering.model.CycleState;
import com.seederr.tiering.model.OperationKind;
import com.seederr.tiering.model.OperationStatus;
import com.seederr.tiering.model.PayloadSnapshot;
import com.seederr.tiering.model.RelocationOperation;
import com.seederr.tiering.model.Tier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.seederr.tiering.service.TestPayloads.CACHE_ROOT;
import static com.seederr.tiering.service.TestPayloads.MASTER_ROOT;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 单轮调度编排测试
 */
@ExtendWith(MockitoExtension.class)
class RebalanceCycleOrchestratorTest {

    @Mock
    private TorrentSource torrentSource;

    @Mock
    private MetricStore metricStore;

    @Mock
    private StorageStatProvider storageStats;

    @Mock
    private OrphanCacheDetector orphanDetector;

    @Mock
    private RelocationExecutor executor;

    private SeederrProperties properties;
    private CancellationSignal cancellation;
    private SimpleMeterRegistry meterRegistry;
    private RebalanceCycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new SeederrProperties();
        properties.getRebalance().setDryRun(false);
        properties.getRebalance().setMaxOperationsPerCycle(1);
        cancellation = new CancellationSignal();
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new RebalanceCycleOrchestrator(
            torrentSource, metricStore, storageStats,
            new PayloadScorer(properties),
            new CapacityPlanner(),
            orphanDetector,
            new PlacementReconciler(new TierLayout(CACHE_ROOT, MASTER_ROOT)),
            executor,
            new UploadRateTracker(properties),
            cancellation, properties, meterRegistry);
    }

    @Test
    @DisplayName("客户端不可达：不读写指标存储，不产生任何操作")
    void testSourceUnavailable() {
        when(torrentSource.listPayloads()).thenThrow(new SourceUnavailableException("connection refused"));

        CycleReport report = orchestrator.runCycle();

        assertEquals(CycleOutcome.SOURCE_UNAVAILABLE, report.getOutcome());
        assertTrue(report.getOperations().isEmpty());
        verifyNoInteractions(metricStore, executor, storageStats);
        assertSame(report, orchestrator.getLastReport().orElseThrow());
        assertEquals(CycleState.IDLE, orchestrator.getState());
    }

    @Test
    @DisplayName("场景：预算 1 时只执行一次降级，并持久化全部种子的指标")
    void testScenarioBudgetOne() {
        stubScenario();

        CycleReport report = orchestrator.runCycle();

        ArgumentCaptor<RelocationOperation> captor = ArgumentCaptor.forClass(RelocationOperation.class);
        verify(executor, times(1)).execute(captor.capture(), eq(false));
        assertEquals("b", captor.getValue().getHash());
        assertEquals(OperationKind.RELEGATE, captor.getValue().getKind());

        assertEquals(CycleOutcome.COMPLETED, report.getOutcome());
        assertEquals(2, report.getRequiredOperations());
        assertEquals(1, report.getOperations().size());
        assertTrue(report.isPersisted());
        verify(metricStore).upsertAll(argThat(records -> records.size() == 3));
        verify(metricStore).pruneNotSeenSince(any());
    }

    @Test
    @DisplayName("执行数不超过每轮上限")
    void testExecutedNeverExceedsBudget() {
        properties.getRebalance().setMaxOperationsPerCycle(5);
        stubScenario();

        CycleReport report = orchestrator.runCycle();

        verify(executor, times(2)).execute(any(), anyBoolean());
        assertEquals(2, report.getOperations().size());
    }

    @Test
    @DisplayName("预算 0 只评估，不执行")
    void testZeroBudgetEvaluatesOnly() {
        properties.getRebalance().setMaxOperationsPerCycle(0);
        stubScenario();

        CycleReport report = orchestrator.runCycle();

        verifyNoInteractions(executor);
        assertEquals(2, report.getRequiredOperations());
    }

    @Test
    @DisplayName("演练模式把 dry-run 传给执行器")
    void testDryRunPassedToExecutor() {
        properties.getRebalance().setDryRun(true);
        stubScenario();

        CycleReport report = orchestrator.runCycle();

        verify(executor).execute(any(), eq(true));
        assertTrue(report.isDryRun());
    }

    @Test
    @DisplayName("读取历史失败：冷启动评分，继续执行，但跳过持久化")
    void testStoreReadFailureSkipsPersist() {
        stubScenario();
        when(metricStore.getAll(anyCollection()))
            .thenThrow(new StoreUnavailableException("down", new RuntimeException()));

        CycleReport report = orchestrator.runCycle();

        assertEquals(CycleOutcome.COMPLETED, report.getOutcome());
        assertFalse(report.isPersisted());
        verify(executor).execute(any(), anyBoolean());
        verify(metricStore, never()).upsertAll(anyCollection());
        verify(metricStore, never()).pruneNotSeenSince(any());
    }

    @Test
    @DisplayName("持久化失败只记录在报告中")
    void testPersistFailureMarksReport() {
        stubScenario();
        doThrow(new StoreUnavailableException("down", new RuntimeException()))
            .when(metricStore).upsertAll(anyCollection());

        CycleReport report = orchestrator.runCycle();

        assertEquals(CycleOutcome.COMPLETED, report.getOutcome());
        assertFalse(report.isPersisted());
        verify(executor).execute(any(), anyBoolean());
    }

    @Test
    @DisplayName("预览：不执行、不持久化、不覆盖最近一轮报告")
    void testPreview() {
        stubScenario();

        CycleReport report = orchestrator.preview();

        assertTrue(report.isPreview());
        assertTrue(report.isDryRun());
        assertEquals(1, report.getOperations().size());
        assertEquals(OperationStatus.PENDING, report.getOperations().get(0).getStatus());
        verifyNoInteractions(executor);
        verify(metricStore, never()).upsertAll(anyCollection());
        assertTrue(orchestrator.getLastReport().isEmpty());
    }

    @Test
    @DisplayName("停机信号：拉取后即停止")
    void testCancelled() {
        when(torrentSource.listPayloads()).thenReturn(List.of());
        cancellation.cancel();

        CycleReport report = orchestrator.runCycle();

        assertEquals(CycleOutcome.CANCELLED, report.getOutcome());
        verifyNoInteractions(executor, metricStore);
    }

    @Test
    @DisplayName("每轮记录计数与耗时")
    void testCycleMetrics() {
        when(torrentSource.listPayloads()).thenThrow(new SourceUnavailableException("down"));

        orchestrator.runCycle();

        assertEquals(1.0, meterRegistry.get("seederr.cycles").tag("outcome", "SOURCE_UNAVAILABLE").counter().count());
        assertEquals(1, meterRegistry.get("seederr.cycle.duration").timer().count());
    }

    /**
     * 容量 100、填充率 90%：A(60, 有下载者) 在主存储，B(40) 在缓存，C(10) 在主存储，
     * 目标只有 A 在缓存 → 需要降级 B、升级 A
     */
    private void stubScenario() {
        PayloadSnapshot a = TestPayloads.snapshot("a", 60, Tier.MASTER).toBuilder().leechers(5).seeders(2).build();
        PayloadSnapshot b = TestPayloads.snapshot("b", 40, Tier.CACHE).toBuilder().uploadRateBytesPerSecond(1024).build();
        PayloadSnapshot c = TestPayloads.snapshot("c", 10, Tier.MASTER);
        when(torrentSource.listPayloads()).thenReturn(List.of(a, b, c));
        when(storageStats.capacityBytes(Tier.CACHE)).thenReturn(100L);
        when(storageStats.usedBytes(Tier.CACHE)).thenReturn(40L);
        lenient().when(executor.execute(any(), anyBoolean())).thenReturn(OperationStatus.COMPLETED);
    }
}
