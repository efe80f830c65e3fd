package com.seederr.tiering.model;

/**
 * 单轮调度的状态机
 */
public enum CycleState {
    FETCH,
    SCORE,
    PLAN,
    RECONCILE,
    EXECUTE,
    PERSIST,
    IDLE
}
