package com.seederr.tiering.model;

public enum CycleOutcome {
    /** 全部阶段走完（单个操作失败不影响） */
    COMPLETED,
    /** 拉取种子列表失败，本轮未做任何变更 */
    SOURCE_UNAVAILABLE,
    /** 执行阶段被关闭信号打断 */
    CANCELLED,
    /** 未预期的异常 */
    FAILED
}
