package com.seederr.tiering.exception;

import com.seederr.tiering.model.FailureReason;

/**
 * 单个迁移操作失败，只影响该操作
 */
public class RelocationException extends RuntimeException {
    
    private final FailureReason reason;
    
    public RelocationException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
    
    public RelocationException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
    
    public FailureReason getReason() {
        return reason;
    }
}
