package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.MetricRecord;
import com.seederr.tiering.model.PayloadSnapshot;
import com.seederr.tiering.model.ScoredPayload;
import org.springframework.stereotype.Component;

/**
 * 热度评分
 *
 * score = W_leechers * 下载者数
 *       + W_scarcity * 下载者数 / max(做种者数, 1)
 *       + W_long_term * 长期平滑速率
 *       + W_short_term * 瞬时速率
 *
 * 速率单位为 GB/天。尚无历史记录时长期项取瞬时值。
 * 纯函数，所有输入非负时结果非负。
 */
@Component
public class PayloadScorer {

    private final double leechersWeight;
    private final double scarcityWeight;
    private final double longTermWeight;
    private final double shortTermWeight;

    public PayloadScorer(SeederrProperties properties) {
        SeederrProperties.Scoring scoring = properties.getScoring();
        this.leechersWeight = scoring.getLeechersWeight();
        this.scarcityWeight = scoring.getScarcityWeight();
        this.longTermWeight = scoring.getLongTermWeight();
        this.shortTermWeight = scoring.getShortTermWeight();
    }

    /**
     * @param payload 种子快照
     * @param metric  历史指标，可为 null
     */
    public double score(PayloadSnapshot payload, MetricRecord metric) {
        int leechers = payload.getLeechers();
        double scarcity = (double) leechers / Math.max(payload.getSeeders(), 1);
        double instant = toGbPerDay(payload.getUploadRateBytesPerSecond());
        double historical = metric != null ? metric.smoothedRateGbPerDay() : instant;

        return leechersWeight * leechers
            + scarcityWeight * scarcity
            + longTermWeight * historical
            + shortTermWeight * instant;
    }

    public ScoredPayload scored(PayloadSnapshot payload, MetricRecord metric) {
        return new ScoredPayload(payload, score(payload, metric));
    }

    static double toGbPerDay(long bytesPerSecond) {
        return (double) bytesPerSecond * TieringConstants.SECONDS_PER_DAY / TieringConstants.BYTES_PER_GIB;
    }
}
