package com.seederr.tiering.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 单轮调度报告，用于管理接口和健康检查
 */
@Value
@Builder
public class CycleReport {
    
    long cycleId;
    
    Instant startedAt;
    
    Instant finishedAt;
    
    CycleOutcome outcome;
    
    boolean dryRun;
    
    /** 只预览、不执行也不持久化 */
    boolean preview;
    
    int payloadCount;
    
    long cacheCapacityBytes;
    
    long cacheUsedBytes;
    
    long cacheBudgetBytes;
    
    long plannedCacheBytes;
    
    /** 需要的迁移总数（预算截断前） */
    int requiredOperations;
    
    /** 本轮实际选中执行的操作 */
    @Builder.Default
    List<RelocationOperation> operations = List.of();
    
    boolean persisted;
    
    String message;
    
    public long countByStatus(OperationStatus status) {
        return operations.stream().filter(op -> op.getStatus() == status).count();
    }
}
