package com.seederr.tiering.service;

import com.seederr.tiering.model.OperationKind;
import com.seederr.tiering.model.PlacementPlan;
import com.seederr.tiering.model.RelocationOperation;
import com.seederr.tiering.model.ScoredPayload;
import com.seederr.tiering.model.Tier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 孤立缓存副本检测
 *
 * 客户端上报在主存储、本轮也不打算升级的种子，如果缓存盘上还有它的副本
 * （例如上次复制成功但改指向失败），该副本可以清理。
 * 任何被缓存层种子实际使用中的路径都不会被判为孤立。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanCacheDetector {

    private final TierLayout layout;
    private final FileTransferProvider fileTransfer;

    public List<RelocationOperation> detect(List<ScoredPayload> scored, PlacementPlan plan) {
        Set<Path> inUse = scored.stream()
            .filter(p -> p.currentTier() == Tier.CACHE)
            .map(p -> p.payload().getContentPath().toAbsolutePath().normalize())
            .collect(Collectors.toSet());

        List<RelocationOperation> cleanups = new ArrayList<>();
        for (ScoredPayload p : scored) {
            if (!p.payload().isMovable()
                || p.currentTier() != Tier.MASTER
                || plan.targetOf(p.hash()) != Tier.MASTER) {
                continue;
            }

            Path cacheCopy;
            try {
                cacheCopy = layout.counterpart(p.payload().getContentPath(), Tier.MASTER, Tier.CACHE);
            } catch (IllegalArgumentException e) {
                log.debug("No cache counterpart for '{}' ({}): {}", p.payload().getName(), p.hash(), e.getMessage());
                continue;
            }

            if (overlapsInUse(cacheCopy, inUse) || !fileTransfer.exists(cacheCopy)) {
                continue;
            }

            log.info("Orphaned cache copy found for '{}' ({}): {}", p.payload().getName(), p.hash(), cacheCopy);
            cleanups.add(RelocationOperation.builder()
                .kind(OperationKind.CLEANUP)
                .hash(p.hash())
                .name(p.payload().getName())
                .category(p.payload().getCategory())
                .score(p.score())
                .sizeBytes(p.sizeBytes())
                .sourcePath(cacheCopy)
                .build());
        }
        return cleanups;
    }

    private static boolean overlapsInUse(Path candidate, Set<Path> inUse) {
        for (Path used : inUse) {
            if (used.startsWith(candidate) || candidate.startsWith(used)) {
                return true;
            }
        }
        return false;
    }
}
