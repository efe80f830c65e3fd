package com.seederr.tiering.service;

import java.nio.file.Path;

/**
 * 文件复制 / 删除
 * 
 * 失败时抛出 {@link com.seederr.tiering.exception.RelocationException}。
 */
public interface FileTransferProvider {

    /**
     * 复制文件或目录，自动创建父目录（分类子目录），保留修改时间
     */
    void copy(Path source, Path destination);

    /**
     * 目标处已存在、复制时会被跳过的字节数（上一次中断的复制留下的部分）
     */
    long bytesPresent(Path source, Path destination);

    /**
     * 校验目标与源的每个文件都存在且大小一致
     */
    void verify(Path source, Path destination);

    /**
     * 删除文件或整个目录
     */
    void remove(Path path);

    boolean exists(Path path);
}
