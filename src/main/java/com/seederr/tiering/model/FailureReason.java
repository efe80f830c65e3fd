package com.seederr.tiering.model;

/**
 * 单个迁移操作的失败原因
 */
public enum FailureReason {
    /** 复制失败 */
    COPY,
    /** 复制后校验不一致 */
    VERIFY,
    /** 客户端改指向失败或未确认 */
    REPOINT,
    /** 删除缓存副本失败 */
    DELETE,
    /** 缓存盘剩余空间不足 */
    INSUFFICIENT_SPACE,
    /** 路径不安全（不在缓存根目录下、主副本缺失等） */
    UNSAFE_PATH,
    /** 进程关闭，操作在破坏性阶段之前放弃 */
    CANCELLED
}
