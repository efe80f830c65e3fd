package com.seederr.tiering.model;

import java.util.Comparator;

/**
 * 带评分的种子
 */
public record ScoredPayload(PayloadSnapshot payload, double score) {

    /** 排名：分数降序，同分按 hash 升序 */
    public static final Comparator<ScoredPayload> RANKING = Comparator
        .comparingDouble(ScoredPayload::score).reversed()
        .thenComparing(ScoredPayload::hash);

    public String hash() {
        return payload.getHash();
    }

    public Tier currentTier() {
        return payload.getTier();
    }

    public long sizeBytes() {
        return payload.getSizeBytes();
    }
}
