package com.seederr.tiering.model;

/**
 * 存储层
 */
public enum Tier {
    /** SSD 缓存盘，可丢弃的副本 */
    CACHE,
    /** 主存储阵列，永久权威副本 */
    MASTER,
    /** 保存路径不在任何已知根目录下 */
    UNKNOWN;

    public Tier opposite() {
        return switch (this) {
            case CACHE -> MASTER;
            case MASTER -> CACHE;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
