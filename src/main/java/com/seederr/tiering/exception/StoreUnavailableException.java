package com.seederr.tiering.exception;

/**
 * 指标存储（数据库）不可用
 */
public class StoreUnavailableException extends RuntimeException {
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
