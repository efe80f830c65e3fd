package com.seederr.tiering.service;

import com.seederr.tiering.model.Tier;

/**
 * 存储层容量查询，每次调用都重新读取
 */
public interface StorageStatProvider {

    /**
     * 总容量（字节），无法确定时返回 0
     */
    long capacityBytes(Tier tier);

    /**
     * 已用空间（字节），无法确定时返回 0
     */
    long usedBytes(Tier tier);

    default long freeBytes(Tier tier) {
        return Math.max(0, capacityBytes(tier) - usedBytes(tier));
    }
}
