package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.MetricRecord;
import com.seederr.tiering.model.PayloadSnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 上传速率的指数移动平均
 *
 * 速率取两次观测间累计上传量之差除以间隔时间；累计量回退（客户端重置统计）按 0 计。
 * 首次观测时以瞬时速率作为初值。
 */
@Component
public class UploadRateTracker {

    private final double alpha;

    public UploadRateTracker(SeederrProperties properties) {
        this.alpha = properties.getScoring().getEmaAlpha();
    }

    public MetricRecord observe(PayloadSnapshot payload, MetricRecord previous, Instant now) {
        if (previous == null) {
            double instant = PayloadScorer.toGbPerDay(payload.getUploadRateBytesPerSecond());
            return new MetricRecord(payload.getHash(), instant, instant, payload.getUploadedBytes(), now, now);
        }

        long elapsedMillis = Duration.between(previous.lastSeenAt(), now).toMillis();
        double rate;
        if (elapsedMillis <= 0) {
            rate = previous.lastRateGbPerDay();
        } else {
            long delta = Math.max(0, payload.getUploadedBytes() - previous.lastUploadedBytes());
            double bytesPerSecond = delta * 1000.0 / elapsedMillis;
            rate = bytesPerSecond * TieringConstants.SECONDS_PER_DAY / TieringConstants.BYTES_PER_GIB;
        }

        double smoothed = alpha * rate + (1 - alpha) * previous.smoothedRateGbPerDay();
        return new MetricRecord(payload.getHash(), smoothed, rate, payload.getUploadedBytes(),
            previous.firstSeenAt(), now);
    }
}
