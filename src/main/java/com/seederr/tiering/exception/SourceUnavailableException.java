package com.seederr.tiering.exception;

/**
 * 种子来源（qBittorrent）不可达或返回无法解析的数据
 */
public class SourceUnavailableException extends RuntimeException {
    
    public SourceUnavailableException(String message) {
        super(message);
    }
    
    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
