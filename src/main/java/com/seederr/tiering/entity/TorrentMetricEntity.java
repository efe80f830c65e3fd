package com.seederr.tiering.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 种子历史指标实体
 */
@Data
@Entity
@Table(name = "torrent_metrics", indexes = {
    @Index(name = "idx_torrent_metrics_last_seen", columnList = "last_seen_at")
})
public class TorrentMetricEntity {
    
    /** 内容 hash（v1 为 40 位，v2 截断后同样 40 位） */
    @Id
    @Column(name = "hash", length = 64, nullable = false)
    private String hash;
    
    /** 上传速率 EMA（GB/天） */
    @Column(name = "smoothed_rate_gb_day", nullable = false)
    private double smoothedRateGbDay;
    
    /** 最近一轮上传速率（GB/天） */
    @Column(name = "rate_gb_day", nullable = false)
    private double rateGbDay;
    
    /** 最近一轮累计上传字节数 */
    @Column(name = "last_uploaded", nullable = false)
    private long lastUploaded;
    
    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;
    
    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;
}
