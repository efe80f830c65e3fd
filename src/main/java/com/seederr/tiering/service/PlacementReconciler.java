package com.seederr.tiering.service;

import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.OperationKind;
import com.seederr.tiering.model.PlacementPlan;
import com.seederr.tiering.model.RelocationOperation;
import com.seederr.tiering.model.ScoredPayload;
import com.seederr.tiering.model.Tier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 放置对账：对比目标层与当前层，生成有序的迁移操作并按每轮预算截断
 *
 * 顺序：孤立缓存副本清理 → 降级（分数升序）→ 升级（分数降序），同分按 hash 升序。
 * 先腾空间再占空间，预算再小也总是先做最有价值的那一步。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlacementReconciler {

    private static final Logger audit = LoggerFactory.getLogger(TieringConstants.AUDIT_LOGGER);

    private static final Comparator<ScoredPayload> WORST_FIRST = Comparator
        .comparingDouble(ScoredPayload::score)
        .thenComparing(ScoredPayload::hash);

    private final TierLayout layout;

    /**
     * @param scored    本轮全部种子
     * @param plan      目标放置方案
     * @param cleanups  孤立缓存副本的清理操作
     * @param opBudget  每轮最多执行的操作数，0 只评估
     */
    public Result reconcile(List<ScoredPayload> scored,
                            PlacementPlan plan,
                            List<RelocationOperation> cleanups,
                            int opBudget) {
        List<RelocationOperation> ordered = new ArrayList<>(cleanups);
        ordered.sort(Comparator.comparing(RelocationOperation::getHash));

        scored.stream()
            .filter(p -> p.payload().isMovable())
            .filter(p -> p.currentTier() == Tier.CACHE && plan.targetOf(p.hash()) == Tier.MASTER)
            .sorted(WORST_FIRST)
            .map(p -> toOperation(p, OperationKind.RELEGATE))
            .flatMap(Optional::stream)
            .forEach(ordered::add);

        scored.stream()
            .filter(p -> p.payload().isMovable())
            .filter(p -> p.currentTier() == Tier.MASTER && plan.targetOf(p.hash()) == Tier.CACHE)
            .sorted(ScoredPayload.RANKING)
            .map(p -> toOperation(p, OperationKind.PROMOTE))
            .flatMap(Optional::stream)
            .forEach(ordered::add);

        List<RelocationOperation> selected = List.copyOf(ordered.subList(0, Math.min(Math.max(opBudget, 0), ordered.size())));

        logDecisions(scored, plan, ordered, selected);
        log.info("Analysis complete: {} promotion(s), {} relegation(s), {} cleanup(s) required; {} scheduled (budget {})",
            count(ordered, OperationKind.PROMOTE),
            count(ordered, OperationKind.RELEGATE),
            count(ordered, OperationKind.CLEANUP),
            selected.size(), opBudget);

        return new Result(List.copyOf(ordered), selected);
    }

    private Optional<RelocationOperation> toOperation(ScoredPayload p, OperationKind kind) {
        Tier from = kind == OperationKind.PROMOTE ? Tier.MASTER : Tier.CACHE;
        Tier to = from.opposite();
        try {
            return Optional.of(RelocationOperation.builder()
                .kind(kind)
                .hash(p.hash())
                .name(p.payload().getName())
                .category(p.payload().getCategory())
                .score(p.score())
                .sizeBytes(p.sizeBytes())
                .sourcePath(p.payload().getContentPath())
                .destinationPath(layout.counterpart(p.payload().getContentPath(), from, to))
                .repointTo(layout.counterpart(p.payload().getSavePath(), from, to))
                .build());
        } catch (IllegalArgumentException e) {
            log.warn("Could not determine relative path for '{}' ({}): {}. Skipping {}.",
                p.payload().getName(), p.hash(), e.getMessage(), kind);
            return Optional.empty();
        }
    }

    private void logDecisions(List<ScoredPayload> scored,
                              PlacementPlan plan,
                              List<RelocationOperation> ordered,
                              List<RelocationOperation> selected) {
        Set<String> required = new HashSet<>();
        ordered.forEach(op -> required.add(op.getHash()));
        Set<String> scheduled = new HashSet<>();
        selected.forEach(op -> scheduled.add(op.getHash()));

        scored.stream().sorted(ScoredPayload.RANKING).forEach(p -> {
            Tier current = p.currentTier();
            Tier target = plan.targetOf(p.hash());
            String action;
            if (!p.payload().isMovable()) {
                action = "PINNED";
            } else if (!required.contains(p.hash())) {
                action = "KEEP";
            } else {
                action = scheduled.contains(p.hash()) ? "MOVE" : "DEFERRED";
            }
            audit.info("decision hash={} name=\"{}\" score={} size={} current={} target={} action={}",
                p.hash(), p.payload().getName(), String.format("%.4f", p.score()),
                p.sizeBytes(), current, target, action);
        });
    }

    private static long count(List<RelocationOperation> ops, OperationKind kind) {
        return ops.stream().filter(op -> op.getKind() == kind).count();
    }

    /**
     * @param required 全部需要的操作（已排序）
     * @param selected 预算内本轮执行的前缀
     */
    public record Result(List<RelocationOperation> required, List<RelocationOperation> selected) {}
}
