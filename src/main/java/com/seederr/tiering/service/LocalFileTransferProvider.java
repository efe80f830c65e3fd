package com.seederr.tiering.service;

import com.seederr.tiering.exception.RelocationException;
import com.seederr.tiering.model.FailureReason;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.filefilter.TrueFileFilter;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * 本地文件系统实现
 *
 * 目标文件已存在且大小、修改时间都与源一致时跳过，
 * 上一轮中断的复制可以接着做而不是整体重来。
 */
@Slf4j
@Component
public class LocalFileTransferProvider implements FileTransferProvider {

    @Override
    public void copy(Path source, Path destination) {
        if (!Files.exists(source)) {
            throw new RelocationException(FailureReason.COPY, "Source does not exist: " + source);
        }
        try {
            if (Files.isDirectory(source)) {
                FileUtils.forceMkdir(destination.toFile());
            }
            int copied = 0;
            int skipped = 0;
            for (File file : filesUnder(source)) {
                Path target = destination.resolve(source.relativize(file.toPath()));
                if (isSameFile(file, target.toFile())) {
                    skipped++;
                    continue;
                }
                FileUtils.copyFile(file, target.toFile(), true);
                copied++;
            }
            log.debug("Copied {} -> {} ({} files copied, {} already present)", source, destination, copied, skipped);
        } catch (IOException e) {
            throw new RelocationException(FailureReason.COPY,
                "Copy " + source + " -> " + destination + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long bytesPresent(Path source, Path destination) {
        if (!Files.exists(source) || !Files.exists(destination)) {
            return 0L;
        }
        long present = 0L;
        for (File file : filesUnder(source)) {
            Path target = destination.resolve(source.relativize(file.toPath()));
            if (isSameFile(file, target.toFile())) {
                present += file.length();
            }
        }
        return present;
    }

    @Override
    public void verify(Path source, Path destination) {
        try {
            for (File file : filesUnder(source)) {
                Path target = destination.resolve(source.relativize(file.toPath()));
                if (!Files.isRegularFile(target)) {
                    throw new RelocationException(FailureReason.VERIFY, "Missing after copy: " + target);
                }
                long expected = file.length();
                long actual = Files.size(target);
                if (expected != actual) {
                    throw new RelocationException(FailureReason.VERIFY,
                        "Size mismatch for " + target + ": expected " + expected + " but was " + actual);
                }
            }
        } catch (IOException e) {
            throw new RelocationException(FailureReason.VERIFY,
                "Verify " + destination + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(Path path) {
        if (!Files.exists(path)) {
            log.warn("Nothing to remove, path already absent: {}", path);
            return;
        }
        try {
            FileUtils.forceDelete(path.toFile());
        } catch (IOException e) {
            throw new RelocationException(FailureReason.DELETE, "Remove " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    private Collection<File> filesUnder(Path source) {
        if (Files.isDirectory(source)) {
            return FileUtils.listFiles(source.toFile(), TrueFileFilter.INSTANCE, TrueFileFilter.INSTANCE);
        }
        return List.of(source.toFile());
    }

    private boolean isSameFile(File source, File target) {
        return target.isFile()
            && target.length() == source.length()
            && target.lastModified() == source.lastModified();
    }
}
