package com.seederr.tiering.model;

import com.seederr.tiering.constant.TieringConstants;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * 单轮拉取到的种子快照
 * 
 * 所在层（tier）每轮都由客户端上报的保存路径重新推导，不在本地记忆。
 */
@Value
@Builder(toBuilder = true)
public class PayloadSnapshot {
    
    /** 内容 hash，唯一且不变 */
    String hash;
    
    /** 种子名称 */
    String name;
    
    /** 分类，对应存储根目录下的子目录 */
    String category;
    
    /** 内容大小（字节） */
    long sizeBytes;
    
    /** 整个 swarm 的做种者数量 */
    int seeders;
    
    /** 整个 swarm 的下载者数量 */
    int leechers;
    
    /** 瞬时上传速率（字节/秒） */
    long uploadRateBytesPerSecond;
    
    /** 累计上传字节数 */
    long uploadedBytes;
    
    /** 客户端上报的保存路径 */
    Path savePath;
    
    /** 客户端上报的内容路径（单文件种子为文件，多文件种子为目录） */
    Path contentPath;
    
    /** 下载进度 0-1 */
    double progress;
    
    /** 客户端状态 */
    String state;
    
    /** 当前所在层 */
    Tier tier;
    
    /**
     * 是否允许调度：所在层已知、已下载完成、客户端不在校验/移动中
     */
    public boolean isMovable() {
        return tier != Tier.UNKNOWN
            && progress >= 1.0
            && (state == null || !TieringConstants.QBIT_BUSY_STATES.contains(state));
    }
}
