package com.seederr.tiering.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Seederr 配置属性类
 *
 * 非法配置（权重为负、百分比越界、两个存储根目录重叠等）在启动阶段即失败，
 * 进程不会进入调度循环。
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "seederr")
public class SeederrProperties {

    /** qBittorrent WebUI 配置 */
    @Valid
    @NotNull
    private Qbittorrent qbittorrent = new Qbittorrent();

    /** 存储层配置 */
    @Valid
    @NotNull
    private Tiers tiers = new Tiers();

    /** 调度配置 */
    @Valid
    @NotNull
    private Rebalance rebalance = new Rebalance();

    /** 评分权重 */
    @Valid
    @NotNull
    private Scoring scoring = new Scoring();

    /** 指标存储配置 */
    @Valid
    @NotNull
    private MetricsStore metricsStore = new MetricsStore();

    @Data
    public static class Qbittorrent {
        /** WebUI 地址，例如 http://qbittorrent:8080 */
        @NotBlank
        private String baseUrl = "http://localhost:8080";
        /** 用户名 */
        private String username = "admin";
        /** 密码 */
        private String password = "";
        /** 连接超时 */
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** 读取超时 */
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        /** 网络失败时的最大尝试次数 */
        @Min(1)
        private int retryAttempts = 3;
        /** 重试间隔 */
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Tiers {
        /** SSD 缓存根目录 */
        @NotNull
        private Path cacheRoot;
        /** 主存储根目录 */
        @NotNull
        private Path masterRoot;
        /** 手动指定的缓存盘容量（GB），为空时自动探测 */
        @Positive
        private Long manualCacheCapacityGb;

        @AssertTrue(message = "cache-root and master-root must be distinct and must not contain each other")
        public boolean isRootsDisjoint() {
            if (cacheRoot == null || masterRoot == null) {
                return true;
            }
            Path cache = cacheRoot.toAbsolutePath().normalize();
            Path master = masterRoot.toAbsolutePath().normalize();
            return !cache.startsWith(master) && !master.startsWith(cache);
        }
    }

    @Data
    public static class Rebalance {
        /** 两次调度之间的间隔，纯数字按秒解析 */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration checkInterval = Duration.ofHours(1);
        /** 首次调度延迟 */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration initialDelay = Duration.ofSeconds(30);
        /** 缓存盘目标填充率（0-100） */
        @Min(0)
        @Max(100)
        private int targetFillPercent = 90;
        /** 每轮最多执行的迁移数，0 表示只评估不执行 */
        @Min(0)
        private int maxOperationsPerCycle = 1;
        /** 演练模式 */
        private boolean dryRun = true;
        /** 是否启动定时调度（测试环境关闭） */
        private boolean schedulerEnabled = true;
        /** 管理接口预览的最长等待时间 */
        @NotNull
        private Duration previewTimeout = Duration.ofMinutes(2);
        /** 降级改指向后，轮询客户端确认移动完成的最大次数 */
        @Min(1)
        private int moveConfirmAttempts = 30;
        /** 两次确认轮询之间的间隔 */
        @NotNull
        private Duration moveConfirmInterval = Duration.ofSeconds(10);

        @AssertTrue(message = "check-interval and move-confirm-interval must be positive")
        public boolean isIntervalsPositive() {
            return isPositive(checkInterval) && isPositive(moveConfirmInterval);
        }

        private static boolean isPositive(Duration duration) {
            return duration == null || (!duration.isNegative() && !duration.isZero());
        }
    }

    @Data
    public static class Scoring {
        /** 下载者数量权重 */
        @DecimalMin("0.0")
        private double leechersWeight = 1000.0;
        /** 稀缺度（下载者 / 做种者）权重 */
        @DecimalMin("0.0")
        private double scarcityWeight = 200.0;
        /** 长期平滑上传速率权重 */
        @DecimalMin("0.0")
        private double longTermWeight = 0.8;
        /** 瞬时上传速率权重 */
        @DecimalMin("0.0")
        private double shortTermWeight = 0.2;
        /** 指数移动平均系数 */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double emaAlpha = 0.012;
    }

    @Data
    public static class MetricsStore {
        /** 种子消失多久后清理其历史指标 */
        @NotNull
        private Duration staleGracePeriod = Duration.ofDays(7);
    }
}
