package com.seederr.tiering.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 本轮的目标放置方案
 *
 * @param targets          hash → 目标层
 * @param budgetBytes      缓存盘可用预算（容量 × 目标填充率）
 * @param plannedCacheBytes 方案中缓存层的总字节数
 */
public record PlacementPlan(Map<String, Tier> targets, long budgetBytes, long plannedCacheBytes) {

    public PlacementPlan {
        targets = Collections.unmodifiableMap(targets);
    }

    public Tier targetOf(String hash) {
        return targets.getOrDefault(hash, Tier.MASTER);
    }

    public Set<String> cacheSet() {
        return targets.entrySet().stream()
            .filter(e -> e.getValue() == Tier.CACHE)
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }
}
