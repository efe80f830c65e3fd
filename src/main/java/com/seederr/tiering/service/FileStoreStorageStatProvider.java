package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.model.Tier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;

/**
 * 基于文件系统的容量查询
 * 
 * 配置了 manual-cache-capacity-gb 时缓存盘容量使用手动值（远程测试时缓存盘未挂载）。
 */
@Slf4j
@Component
public class FileStoreStorageStatProvider implements StorageStatProvider {
    
    private final TierLayout layout;
    private final Long manualCacheCapacityGb;
    
    public FileStoreStorageStatProvider(TierLayout layout, SeederrProperties properties) {
        this.layout = layout;
        this.manualCacheCapacityGb = properties.getTiers().getManualCacheCapacityGb();
    }
    
    @Override
    public long capacityBytes(Tier tier) {
        if (tier == Tier.CACHE && manualCacheCapacityGb != null) {
            return manualCacheCapacityGb * TieringConstants.BYTES_PER_GIB;
        }
        try {
            return fileStore(tier).getTotalSpace();
        } catch (IOException e) {
            log.error("Cannot determine capacity of {} root '{}': {}", tier, layout.rootOf(tier), e.getMessage());
            return 0;
        }
    }
    
    @Override
    public long usedBytes(Tier tier) {
        try {
            FileStore store = fileStore(tier);
            return store.getTotalSpace() - store.getUsableSpace();
        } catch (IOException e) {
            log.error("Cannot determine used space of {} root '{}': {}", tier, layout.rootOf(tier), e.getMessage());
            return 0;
        }
    }
    
    private FileStore fileStore(Tier tier) throws IOException {
        return Files.getFileStore(layout.rootOf(tier));
    }
}
