package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.exception.SourceUnavailableException;
import com.seederr.tiering.model.FailureReason;
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
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 迁移执行器单元测试
 */
@ExtendWith(MockitoExtension.class)
class RelocationExecutorTest {

    private static final String HASH = "abc123";

    @TempDir
    Path tempDir;

    @Mock
    private TorrentSource torrentSource;

    @Mock
    private StorageStatProvider storageStats;

    @Mock
    private FileTransferProvider mockTransfer;

    private Path cacheRoot;
    private Path masterRoot;
    private TierLayout layout;
    private CancellationSignal cancellation;
    private SeederrProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RelocationExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        cacheRoot = Files.createDirectories(tempDir.resolve("cache"));
        masterRoot = Files.createDirectories(tempDir.resolve("master"));
        layout = new TierLayout(cacheRoot, masterRoot);
        cancellation = new CancellationSignal();
        meterRegistry = new SimpleMeterRegistry();
        properties = new SeederrProperties();
        properties.getRebalance().setMoveConfirmAttempts(3);
        properties.getRebalance().setMoveConfirmInterval(Duration.ofMillis(1));
        executor = new RelocationExecutor(torrentSource, new LocalFileTransferProvider(),
            storageStats, layout, cancellation, properties, meterRegistry);
    }

    @Test
    @DisplayName("升级：复制、校验后改指向缓存，主存储副本不动")
    void testPromote() throws IOException {
        Path masterContent = createPayload(masterRoot);
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(Long.MAX_VALUE);
        when(torrentSource.setSaveLocation(HASH, cacheRoot.resolve("movies"))).thenReturn(true);

        RelocationOperation op = promote();
        OperationStatus status = executor.execute(op, false);

        assertEquals(OperationStatus.COMPLETED, status);
        Path cacheContent = cacheRoot.resolve("movies/Tenet");
        assertEquals("episode one", Files.readString(cacheContent.resolve("a.mkv")));
        assertEquals("episode two!", Files.readString(cacheContent.resolve("sub/b.mkv")));
        assertTrue(Files.exists(masterContent.resolve("a.mkv")));
        assertEquals(Files.getLastModifiedTime(masterContent.resolve("a.mkv")),
            Files.getLastModifiedTime(cacheContent.resolve("a.mkv")));
    }

    @Test
    @DisplayName("升级：复制失败时不改指向")
    void testPromoteCopyFailureDoesNotRepoint() {
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(Long.MAX_VALUE);

        RelocationOperation op = promote();
        OperationStatus status = executor.execute(op, false);

        assertEquals(OperationStatus.FAILED, status);
        assertEquals(FailureReason.COPY, op.getFailureReason());
        verify(torrentSource, never()).setSaveLocation(anyString(), any());
    }

    @Test
    @DisplayName("升级：改指向失败时保留缓存副本，客户端仍指向主存储")
    void testPromoteRepointFailureKeepsCacheCopy() throws IOException {
        createPayload(masterRoot);
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(Long.MAX_VALUE);
        when(torrentSource.setSaveLocation(anyString(), any())).thenReturn(false);

        RelocationOperation op = promote();
        OperationStatus status = executor.execute(op, false);

        assertEquals(OperationStatus.FAILED, status);
        assertEquals(FailureReason.REPOINT, op.getFailureReason());
        assertTrue(Files.exists(cacheRoot.resolve("movies/Tenet/a.mkv")));
        assertTrue(Files.exists(masterRoot.resolve("movies/Tenet/a.mkv")));
    }

    @Test
    @DisplayName("升级：缓存剩余空间不足时不复制")
    void testPromoteInsufficientSpace() throws IOException {
        createPayload(masterRoot);
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(1L);

        RelocationOperation op = promote();
        executor.execute(op, false);

        assertEquals(FailureReason.INSUFFICIENT_SPACE, op.getFailureReason());
        assertFalse(Files.exists(cacheRoot.resolve("movies/Tenet")));
        verifyNoInteractions(torrentSource);
    }

    @Test
    @DisplayName("升级：上次中断的复制已占用的空间不再计入，剩余部分放得下即可续传")
    void testPromoteResumesPartialCopy() throws IOException {
        Path masterContent = createPayload(masterRoot);
        Path cacheContent = cacheRoot.resolve("movies/Tenet");
        new LocalFileTransferProvider().copy(masterContent.resolve("a.mkv"), cacheContent.resolve("a.mkv"));
        // 只够放下还没复制的 b.mkv（12 字节）
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(12L);
        when(torrentSource.setSaveLocation(HASH, cacheRoot.resolve("movies"))).thenReturn(true);

        RelocationOperation op = promote();
        OperationStatus status = executor.execute(op, false);

        assertEquals(OperationStatus.COMPLETED, status, op.getMessage());
        assertEquals("episode two!", Files.readString(cacheContent.resolve("sub/b.mkv")));
    }

    @Test
    @DisplayName("升级：已复制部分之外的剩余空间仍不足时失败")
    void testPromotePartialCopyStillTooLarge() throws IOException {
        Path masterContent = createPayload(masterRoot);
        Path cacheContent = cacheRoot.resolve("movies/Tenet");
        new LocalFileTransferProvider().copy(masterContent.resolve("a.mkv"), cacheContent.resolve("a.mkv"));
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(11L);

        RelocationOperation op = promote();
        executor.execute(op, false);

        assertEquals(FailureReason.INSUFFICIENT_SPACE, op.getFailureReason());
        assertFalse(Files.exists(cacheContent.resolve("sub/b.mkv")));
        verifyNoInteractions(torrentSource);
    }

    @Test
    @DisplayName("降级：先改指向，确认成功后才删除缓存副本")
    void testRelegateRepointsBeforeRemove() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);
        RelocationOperation op = relegate();
        when(mockTransfer.exists(op.getDestinationPath())).thenReturn(true);
        when(torrentSource.setSaveLocation(HASH, masterRoot.resolve("movies"))).thenReturn(true);
        when(torrentSource.findPayload(HASH)).thenReturn(reported(masterRoot, Tier.MASTER, "stalledUP"));

        OperationStatus status = mocked.execute(op, false);

        assertEquals(OperationStatus.COMPLETED, status);
        InOrder inOrder = inOrder(torrentSource, mockTransfer);
        inOrder.verify(torrentSource).setSaveLocation(HASH, masterRoot.resolve("movies"));
        inOrder.verify(torrentSource).findPayload(HASH);
        inOrder.verify(mockTransfer).remove(op.getSourcePath());
    }

    @Test
    @DisplayName("降级：客户端仍在移动时继续轮询，移动完成后才删除缓存副本")
    void testRelegateWaitsForMoveToFinish() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);
        RelocationOperation op = relegate();
        when(mockTransfer.exists(op.getDestinationPath())).thenReturn(true);
        when(torrentSource.setSaveLocation(HASH, masterRoot.resolve("movies"))).thenReturn(true);
        when(torrentSource.findPayload(HASH))
            .thenReturn(reported(cacheRoot, Tier.CACHE, "moving"))
            .thenReturn(reported(masterRoot, Tier.MASTER, "stalledUP"));

        OperationStatus status = mocked.execute(op, false);

        assertEquals(OperationStatus.COMPLETED, status);
        verify(torrentSource, times(2)).findPayload(HASH);
        verify(mockTransfer).remove(op.getSourcePath());
    }

    @Test
    @DisplayName("降级：客户端一直未完成移动时失败并保留缓存副本")
    void testRelegateKeepsCacheCopyWhenMoveNeverFinishes() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);
        RelocationOperation op = relegate();
        when(mockTransfer.exists(op.getDestinationPath())).thenReturn(true);
        when(torrentSource.setSaveLocation(HASH, masterRoot.resolve("movies"))).thenReturn(true);
        when(torrentSource.findPayload(HASH)).thenReturn(reported(cacheRoot, Tier.CACHE, "moving"));

        OperationStatus status = mocked.execute(op, false);

        assertEquals(OperationStatus.FAILED, status);
        assertEquals(FailureReason.REPOINT, op.getFailureReason());
        verify(torrentSource, times(3)).findPayload(HASH);
        verify(mockTransfer, never()).remove(any());
    }

    @Test
    @DisplayName("降级：改指向成功后收到停机信号，保留缓存副本")
    void testRelegateCancelledAfterRepointKeepsCacheCopy() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);
        RelocationOperation op = relegate();
        when(mockTransfer.exists(op.getDestinationPath())).thenReturn(true);
        when(torrentSource.setSaveLocation(HASH, masterRoot.resolve("movies"))).thenAnswer(invocation -> {
            cancellation.cancel();
            return true;
        });

        OperationStatus status = mocked.execute(op, false);

        assertEquals(OperationStatus.FAILED, status);
        assertEquals(FailureReason.CANCELLED, op.getFailureReason());
        verify(mockTransfer, never()).remove(any());
    }

    @Test
    @DisplayName("降级：改指向失败时保留缓存副本")
    void testRelegateRepointFailureRetainsCacheCopy() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);
        RelocationOperation op = relegate();
        when(mockTransfer.exists(op.getDestinationPath())).thenReturn(true);
        when(torrentSource.setSaveLocation(anyString(), any()))
            .thenThrow(new SourceUnavailableException("connection refused"));

        OperationStatus status = mocked.execute(op, false);

        assertEquals(OperationStatus.FAILED, status);
        assertEquals(FailureReason.REPOINT, op.getFailureReason());
        verify(mockTransfer, never()).remove(any());
    }

    @Test
    @DisplayName("降级：主存储副本不存在时拒绝执行")
    void testRelegateRefusedWithoutMasterCopy() throws IOException {
        createPayload(cacheRoot);

        RelocationOperation op = relegate();
        executor.execute(op, false);

        assertEquals(FailureReason.UNSAFE_PATH, op.getFailureReason());
        assertTrue(Files.exists(cacheRoot.resolve("movies/Tenet/a.mkv")));
        verifyNoInteractions(torrentSource);
    }

    @Test
    @DisplayName("升级再降级：主存储内容逐字节不变，缓存清空")
    void testRoundTripLeavesMasterIdentical() throws IOException {
        Path masterContent = createPayload(masterRoot);
        byte[] before = Files.readAllBytes(masterContent.resolve("sub/b.mkv"));
        when(storageStats.freeBytes(Tier.CACHE)).thenReturn(Long.MAX_VALUE);
        when(torrentSource.setSaveLocation(anyString(), any())).thenReturn(true);
        when(torrentSource.findPayload(HASH)).thenReturn(reported(masterRoot, Tier.MASTER, "uploading"));

        assertEquals(OperationStatus.COMPLETED, executor.execute(promote(), false));
        assertEquals(OperationStatus.COMPLETED, executor.execute(relegate(), false));

        assertArrayEquals(before, Files.readAllBytes(masterContent.resolve("sub/b.mkv")));
        assertTrue(Files.exists(masterContent.resolve("a.mkv")));
        assertFalse(Files.exists(cacheRoot.resolve("movies/Tenet")));
    }

    @Test
    @DisplayName("演练模式不调用客户端，也不改动文件")
    void testDryRunHasNoSideEffects() throws IOException {
        createPayload(masterRoot);

        RelocationOperation op = promote();
        OperationStatus status = executor.execute(op, true);

        assertEquals(OperationStatus.COMPLETED, status);
        assertFalse(Files.exists(cacheRoot.resolve("movies/Tenet")));
        verifyNoInteractions(torrentSource, storageStats);
    }

    @Test
    @DisplayName("演练模式的降级同样不删除任何文件")
    void testDryRunRelegateKeepsFiles() {
        RelocationExecutor mocked = new RelocationExecutor(torrentSource, mockTransfer,
            storageStats, layout, cancellation, properties, meterRegistry);

        mocked.execute(relegate(), true);

        verifyNoInteractions(torrentSource, mockTransfer, storageStats);
    }

    @Test
    @DisplayName("删除路径不在缓存根目录内时拒绝")
    void testUnsafeCleanupRefused() throws IOException {
        Path masterContent = createPayload(masterRoot);
        RelocationOperation op = RelocationOperation.builder()
            .kind(OperationKind.CLEANUP)
            .hash(HASH)
            .name("Tenet")
            .sourcePath(masterContent)
            .build();

        executor.execute(op, false);

        assertEquals(FailureReason.UNSAFE_PATH, op.getFailureReason());
        assertTrue(Files.exists(masterContent.resolve("a.mkv")));
    }

    @Test
    @DisplayName("清理孤立缓存副本")
    void testCleanupRemovesCacheCopy() throws IOException {
        Path cacheContent = createPayload(cacheRoot);
        RelocationOperation op = RelocationOperation.builder()
            .kind(OperationKind.CLEANUP)
            .hash(HASH)
            .name("Tenet")
            .sourcePath(cacheContent)
            .build();

        assertEquals(OperationStatus.COMPLETED, executor.execute(op, false));
        assertFalse(Files.exists(cacheContent));
        verifyNoInteractions(torrentSource);
    }

    @Test
    @DisplayName("已收到停机信号时不开始任何阶段")
    void testCancelledBeforeStart() throws IOException {
        createPayload(masterRoot);
        cancellation.cancel();

        RelocationOperation op = promote();
        executor.execute(op, false);

        assertEquals(FailureReason.CANCELLED, op.getFailureReason());
        assertFalse(Files.exists(cacheRoot.resolve("movies/Tenet")));
        verifyNoInteractions(torrentSource, storageStats);
    }

    @Test
    @DisplayName("每个操作都记录计数指标")
    void testOperationCounter() {
        executor.execute(promote(), true);

        assertEquals(1.0, meterRegistry.get(TieringConstants.METRIC_OPERATIONS)
            .tag("kind", "PROMOTE")
            .tag("status", "COMPLETED")
            .tag("dryRun", "true")
            .counter()
            .count());
    }

    private Path createPayload(Path root) throws IOException {
        Path content = Files.createDirectories(root.resolve("movies/Tenet/sub"));
        Files.writeString(root.resolve("movies/Tenet/a.mkv"), "episode one", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("movies/Tenet/sub/b.mkv"), "episode two!", StandardCharsets.UTF_8);
        return content.getParent();
    }

    private Optional<PayloadSnapshot> reported(Path root, Tier tier, String state) {
        return Optional.of(PayloadSnapshot.builder()
            .hash(HASH)
            .name("Tenet")
            .category("movies")
            .sizeBytes(23)
            .savePath(root.resolve("movies"))
            .contentPath(root.resolve("movies/Tenet"))
            .progress(1.0)
            .state(state)
            .tier(tier)
            .build());
    }

    private RelocationOperation promote() {
        return RelocationOperation.builder()
            .kind(OperationKind.PROMOTE)
            .hash(HASH)
            .name("Tenet")
            .category("movies")
            .sizeBytes(23)
            .sourcePath(masterRoot.resolve("movies/Tenet"))
            .destinationPath(cacheRoot.resolve("movies/Tenet"))
            .repointTo(cacheRoot.resolve("movies"))
            .build();
    }

    private RelocationOperation relegate() {
        return RelocationOperation.builder()
            .kind(OperationKind.RELEGATE)
            .hash(HASH)
            .name("Tenet")
            .category("movies")
            .sizeBytes(23)
            .sourcePath(cacheRoot.resolve("movies/Tenet"))
            .destinationPath(masterRoot.resolve("movies/Tenet"))
            .repointTo(masterRoot.resolve("movies"))
            .build();
    }
}
