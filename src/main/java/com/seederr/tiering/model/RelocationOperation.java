package com.seederr.tiering.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * 单个迁移操作，只在一轮调度内存在
 * 
 * PROMOTE: source=主存储内容路径, destination=缓存内容路径, repointTo=缓存保存路径
 * RELEGATE: source=缓存内容路径, destination=主存储内容路径, repointTo=主存储保存路径
 * CLEANUP: source=待删除的缓存内容路径
 */
@Data
@Builder
public class RelocationOperation {
    
    private OperationKind kind;
    
    private String hash;
    
    private String name;
    
    private String category;
    
    private double score;
    
    private long sizeBytes;
    
    private Path sourcePath;
    
    private Path destinationPath;
    
    private Path repointTo;
    
    @Builder.Default
    private OperationStatus status = OperationStatus.PENDING;
    
    private FailureReason failureReason;
    
    private String message;
    
    public void fail(FailureReason reason, String message) {
        this.status = OperationStatus.FAILED;
        this.failureReason = reason;
        this.message = message;
    }
}
