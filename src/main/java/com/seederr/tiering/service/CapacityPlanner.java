package com.seederr.tiering.service;

import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.PlacementPlan;
import com.seederr.tiering.model.ScoredPayload;
import com.seederr.tiering.model.Tier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 容量规划：选出放进缓存盘的 Top-K
 *
 * 按排名累加大小，严格前缀截断：第一个放不下的种子及其后所有种子都留在主存储，
 * 即使后面有更小的种子单独能放下。
 *
 * 当前不可调度的种子（未完成、校验中等）保持原位：已在缓存上的先占用预算。
 */
@Slf4j
@Component
public class CapacityPlanner {

    public PlacementPlan plan(List<ScoredPayload> scored, long cacheCapacityBytes, int targetFillPercent) {
        Map<String, Tier> targets = new HashMap<>();

        if (cacheCapacityBytes <= 0) {
            scored.forEach(p -> targets.put(p.hash(), Tier.MASTER));
            log.warn("Cache capacity unknown or zero, planning all {} payloads to MASTER", scored.size());
            return new PlacementPlan(targets, 0, 0);
        }

        long budget = (long) Math.floor(cacheCapacityBytes * (targetFillPercent / 100.0));
        long planned = 0;

        for (ScoredPayload p : scored) {
            if (!p.payload().isMovable()) {
                Tier pinned = p.currentTier() == Tier.CACHE ? Tier.CACHE : Tier.MASTER;
                targets.put(p.hash(), pinned);
                if (pinned == Tier.CACHE) {
                    planned += p.sizeBytes();
                }
            }
        }

        List<ScoredPayload> ranked = scored.stream()
            .filter(p -> p.payload().isMovable())
            .sorted(ScoredPayload.RANKING)
            .toList();

        boolean truncated = false;
        int cacheCount = 0;
        for (ScoredPayload p : ranked) {
            if (!truncated && planned + p.sizeBytes() <= budget) {
                targets.put(p.hash(), Tier.CACHE);
                planned += p.sizeBytes();
                cacheCount++;
            } else {
                truncated = true;
                targets.put(p.hash(), Tier.MASTER);
            }
        }

        log.info("Cache capacity: {} GB, target usage: {} GB ({}%), planned: {} GB across {} movable payloads",
            gib(cacheCapacityBytes), gib(budget), targetFillPercent, gib(planned), cacheCount);

        return new PlacementPlan(targets, budget, planned);
    }

    private static String gib(long bytes) {
        return String.format("%.2f", (double) bytes / TieringConstants.BYTES_PER_GIB);
    }
}
