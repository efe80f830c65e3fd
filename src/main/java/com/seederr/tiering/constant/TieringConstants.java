package com.seederr.tiering.constant;

import java.util.Set;

/**
 * 分层调度相关常量
 */
public final class TieringConstants {
    
    private TieringConstants() {}
    
    // ==================== 单位换算 ====================
    
    /** 1 GiB 字节数 */
    public static final long BYTES_PER_GIB = 1024L * 1024L * 1024L;
    
    /** 一天的秒数 */
    public static final long SECONDS_PER_DAY = 86_400L;
    
    // ==================== 日志 ====================
    
    /** 审计日志 Logger 名称（每个决策、每个操作一行） */
    public static final String AUDIT_LOGGER = "seederr.audit";
    
    /** 演练模式日志前缀 */
    public static final String DRY_RUN_MARKER = "[DRY RUN]";
    
    // ==================== qBittorrent ====================
    
    /** 登录接口 */
    public static final String QBIT_LOGIN_PATH = "/api/v2/auth/login";
    
    /** 种子列表接口 */
    public static final String QBIT_TORRENTS_INFO_PATH = "/api/v2/torrents/info?filter=all";
    
    /** 按 hash 查询单个种子 */
    public static final String QBIT_TORRENT_BY_HASH_PATH = "/api/v2/torrents/info?hashes={hash}";
    
    /** 修改保存路径接口 */
    public static final String QBIT_SET_LOCATION_PATH = "/api/v2/torrents/setLocation";
    
    /** 会话 Cookie 名称 */
    public static final String QBIT_SESSION_COOKIE = "SID";
    
    /** 登录成功响应体 */
    public static final String QBIT_LOGIN_OK = "Ok.";
    
    /**
     * 客户端正在校验、移动或出错的状态，此时不允许调度
     */
    public static final Set<String> QBIT_BUSY_STATES = Set.of(
        "checkingUP",
        "checkingDL",
        "checkingResumeData",
        "moving",
        "allocating",
        "metaDL",
        "missingFiles",
        "error",
        "unknown"
    );
    
    // ==================== 指标名称 ====================
    
    public static final String METRIC_CYCLES = "seederr.cycles";
    
    public static final String METRIC_CYCLE_DURATION = "seederr.cycle.duration";
    
    public static final String METRIC_OPERATIONS = "seederr.operations";
    
    public static final String METRIC_TIER_CAPACITY = "seederr.tier.capacity.bytes";
    
    public static final String METRIC_TIER_USED = "seederr.tier.used.bytes";
}
