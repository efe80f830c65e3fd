package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.exception.RelocationException;
import com.seederr.tiering.exception.SourceUnavailableException;
import com.seederr.tiering.model.FailureReason;
import com.seederr.tiering.model.OperationStatus;
import com.seederr.tiering.model.PayloadSnapshot;
import com.seederr.tiering.model.RelocationOperation;
import com.seederr.tiering.model.Tier;
import io.micrometer.core.instrument.Counter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 迁移执行器
 *
 * 两阶段协议，任何时刻至少保留一份可用副本：
 * <ul>
 *   <li>PROMOTE：复制 → 校验 → 改指向缓存。复制或校验失败不改指向，已复制部分留待下次续传；改指向失败缓存副本留给孤立清理</li>
 *   <li>RELEGATE：确认主存储副本存在 → 改指向主存储 → 轮询客户端直到移动完成 → 删除缓存副本。
 *       客户端未上报已在主存储上空闲做种时绝不删除</li>
 *   <li>CLEANUP：删除客户端已不再使用的缓存副本</li>
 * </ul>
 * 所有删除都限制在缓存根目录之内。单个操作的失败只体现在操作状态上，不向上抛出。
 */
@Slf4j
@Component
public class RelocationExecutor {

    private static final Logger audit = LoggerFactory.getLogger(TieringConstants.AUDIT_LOGGER);

    private final TorrentSource torrentSource;
    private final FileTransferProvider fileTransfer;
    private final StorageStatProvider storageStats;
    private final TierLayout layout;
    private final CancellationSignal cancellation;
    private final MeterRegistry meterRegistry;
    private final Retry moveConfirmRetry;

    public RelocationExecutor(TorrentSource torrentSource,
                              FileTransferProvider fileTransfer,
                              StorageStatProvider storageStats,
                              TierLayout layout,
                              CancellationSignal cancellation,
                              SeederrProperties properties,
                              MeterRegistry meterRegistry) {
        this.torrentSource = torrentSource;
        this.fileTransfer = fileTransfer;
        this.storageStats = storageStats;
        this.layout = layout;
        this.cancellation = cancellation;
        this.meterRegistry = meterRegistry;

        SeederrProperties.Rebalance rebalance = properties.getRebalance();
        RetryConfig config = RetryConfig.<Optional<PayloadSnapshot>>custom()
            .maxAttempts(rebalance.getMoveConfirmAttempts())
            .waitDuration(rebalance.getMoveConfirmInterval())
            .retryOnResult(reported -> !cancellation.isCancelled() && !isSettledOnMaster(reported))
            .retryExceptions(SourceUnavailableException.class)
            .build();
        this.moveConfirmRetry = Retry.of("relocation-confirm", config);
        this.moveConfirmRetry.getEventPublisher()
            .onRetry(event -> log.debug("Move not finished yet, poll #{} in {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval()));
    }

    public OperationStatus execute(RelocationOperation op, boolean dryRun) {
        long start = System.currentTimeMillis();
        op.setStatus(OperationStatus.IN_PROGRESS);

        if (dryRun) {
            simulate(op);
        } else {
            try {
                switch (op.getKind()) {
                    case PROMOTE -> promote(op);
                    case RELEGATE -> relegate(op);
                    case CLEANUP -> cleanup(op);
                }
                op.setStatus(OperationStatus.COMPLETED);
            } catch (RelocationException e) {
                op.fail(e.getReason(), e.getMessage());
                log.error("Failed to {} '{}' ({}): [{}] {}",
                    op.getKind().verb(), op.getName(), op.getHash(), e.getReason(), e.getMessage());
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        audit.info("{}operation kind={} hash={} name=\"{}\" status={} reason={} source={} destination={} elapsedMs={}",
            dryRun ? TieringConstants.DRY_RUN_MARKER + " " : "",
            op.getKind(), op.getHash(), op.getName(), op.getStatus(), op.getFailureReason(),
            op.getSourcePath(), op.getDestinationPath(), elapsed);

        Counter.builder(TieringConstants.METRIC_OPERATIONS)
            .description("Relocation operations by kind and outcome")
            .tag("kind", op.getKind().name())
            .tag("status", op.getStatus().name())
            .tag("dryRun", String.valueOf(dryRun))
            .register(meterRegistry)
            .increment();

        return op.getStatus();
    }

    private void simulate(RelocationOperation op) {
        switch (op.getKind()) {
            case PROMOTE -> {
                log.info("{} would copy '{}' from {} to {}", TieringConstants.DRY_RUN_MARKER,
                    op.getName(), op.getSourcePath(), op.getDestinationPath());
                log.info("{} would set location of {} to {}", TieringConstants.DRY_RUN_MARKER,
                    op.getHash(), op.getRepointTo());
            }
            case RELEGATE -> {
                log.info("{} would set location of {} to {}", TieringConstants.DRY_RUN_MARKER,
                    op.getHash(), op.getRepointTo());
                log.info("{} would delete cache copy {}", TieringConstants.DRY_RUN_MARKER, op.getSourcePath());
            }
            case CLEANUP -> log.info("{} would delete orphaned cache copy {}",
                TieringConstants.DRY_RUN_MARKER, op.getSourcePath());
        }
        op.setStatus(OperationStatus.COMPLETED);
        op.setMessage("simulated");
    }

    private void promote(RelocationOperation op) {
        checkCancelled(op);

        long free = storageStats.freeBytes(Tier.CACHE);
        long present = fileTransfer.bytesPresent(op.getSourcePath(), op.getDestinationPath());
        long needed = Math.max(0L, op.getSizeBytes() - present);
        if (free < needed) {
            throw new RelocationException(FailureReason.INSUFFICIENT_SPACE,
                "cache has " + free + " bytes free, payload needs " + needed
                    + " more (" + present + " of " + op.getSizeBytes() + " already copied)");
        }

        log.info("Promoting '{}' ({}): copying {} -> {}", op.getName(), op.getHash(),
            op.getSourcePath(), op.getDestinationPath());
        fileTransfer.copy(op.getSourcePath(), op.getDestinationPath());
        fileTransfer.verify(op.getSourcePath(), op.getDestinationPath());

        checkCancelled(op);
        repoint(op);
        log.info("Promoted '{}' ({}) to cache", op.getName(), op.getHash());
    }

    private void relegate(RelocationOperation op) {
        checkCancelled(op);

        if (!fileTransfer.exists(op.getDestinationPath())) {
            throw new RelocationException(FailureReason.UNSAFE_PATH,
                "master copy " + op.getDestinationPath() + " does not exist, refusing to relegate");
        }
        fileTransfer.verify(op.getSourcePath(), op.getDestinationPath());

        repoint(op);

        checkCancelled(op);
        awaitMoveToMaster(op);

        checkCancelled(op);
        removeCacheCopy(op.getSourcePath());
        log.info("Relegated '{}' ({}) to master", op.getName(), op.getHash());
    }

    private void cleanup(RelocationOperation op) {
        checkCancelled(op);
        removeCacheCopy(op.getSourcePath());
        log.info("Removed orphaned cache copy of '{}' ({})", op.getName(), op.getHash());
    }

    private void repoint(RelocationOperation op) {
        boolean confirmed;
        try {
            confirmed = torrentSource.setSaveLocation(op.getHash(), op.getRepointTo());
        } catch (SourceUnavailableException e) {
            throw new RelocationException(FailureReason.REPOINT,
                "set location to " + op.getRepointTo() + " failed: " + e.getMessage(), e);
        }
        if (!confirmed) {
            throw new RelocationException(FailureReason.REPOINT,
                "client did not confirm set location to " + op.getRepointTo());
        }
    }

    private void awaitMoveToMaster(RelocationOperation op) {
        Optional<PayloadSnapshot> reported;
        try {
            reported = Retry.decorateSupplier(moveConfirmRetry, () -> torrentSource.findPayload(op.getHash())).get();
        } catch (SourceUnavailableException e) {
            throw new RelocationException(FailureReason.REPOINT,
                "could not confirm move to " + op.getRepointTo() + ": " + e.getMessage(), e);
        }
        checkCancelled(op);
        if (!isSettledOnMaster(reported)) {
            throw new RelocationException(FailureReason.REPOINT,
                "client has not finished moving to " + op.getRepointTo() + ", reported "
                    + reported.map(p -> "save_path=" + p.getSavePath() + " state=" + p.getState())
                        .orElse("no such torrent"));
        }
    }

    private static boolean isSettledOnMaster(Optional<PayloadSnapshot> reported) {
        return reported.map(p -> p.getTier() == Tier.MASTER && p.isMovable()).orElse(false);
    }

    private void removeCacheCopy(Path path) {
        if (!layout.isRemovable(path)) {
            throw new RelocationException(FailureReason.UNSAFE_PATH,
                "refusing to delete " + path + ": not strictly inside the cache root");
        }
        fileTransfer.remove(path);
    }

    private void checkCancelled(RelocationOperation op) {
        if (cancellation.isCancelled()) {
            throw new RelocationException(FailureReason.CANCELLED,
                "shutdown requested before " + op.getKind().verb() + " could continue");
        }
    }
}
