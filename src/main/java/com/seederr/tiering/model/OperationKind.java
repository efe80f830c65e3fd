package com.seederr.tiering.model;

/**
 * 迁移操作类型
 */
public enum OperationKind {
    /** 主存储 → 缓存：复制 + 改指向 */
    PROMOTE("promote"),
    /** 缓存 → 主存储：改指向 + 删除缓存副本 */
    RELEGATE("relegate"),
    /** 清理客户端已不再使用的缓存副本 */
    CLEANUP("clean up");

    private final String verb;

    OperationKind(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }
}
