package com.seederr.tiering.model;

import java.time.Instant;

/**
 * 单个种子的历史指标
 *
 * @param hash                 种子 hash
 * @param smoothedRateGbPerDay 上传速率的指数移动平均（GB/天）
 * @param lastRateGbPerDay     最近一轮观测到的上传速率（GB/天）
 * @param lastUploadedBytes    最近一轮观测到的累计上传字节数
 * @param firstSeenAt          首次观测时间
 * @param lastSeenAt           最近观测时间
 */
public record MetricRecord(
    String hash,
    double smoothedRateGbPerDay,
    double lastRateGbPerDay,
    long lastUploadedBytes,
    Instant firstSeenAt,
    Instant lastSeenAt
) {}
