package com.seederr.tiering.config;

import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.Tier;
import com.seederr.tiering.service.StorageStatProvider;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * 存储层监控指标配置
 * 提供：
 * 1. 缓存 / 主存储总容量
 * 2. 缓存 / 主存储已用空间
 *
 * 调度轮次与迁移操作的计数器在各自组件中注册。
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    private final MeterRegistry meterRegistry;
    private final StorageStatProvider storageStats;

    public MetricsConfig(MeterRegistry meterRegistry, StorageStatProvider storageStats) {
        this.meterRegistry = meterRegistry;
        this.storageStats = storageStats;
    }

    @PostConstruct
    public void initMetrics() {
        for (Tier tier : new Tier[]{Tier.CACHE, Tier.MASTER}) {
            Gauge.builder(TieringConstants.METRIC_TIER_CAPACITY, storageStats, s -> s.capacityBytes(tier))
                .description("Total capacity of the storage tier")
                .tag("tier", tier.name().toLowerCase())
                .baseUnit("bytes")
                .register(meterRegistry);

            Gauge.builder(TieringConstants.METRIC_TIER_USED, storageStats, s -> s.usedBytes(tier))
                .description("Used space on the storage tier")
                .tag("tier", tier.name().toLowerCase())
                .baseUnit("bytes")
                .register(meterRegistry);
        }
        log.info("Storage tier metrics initialized");
    }
}
