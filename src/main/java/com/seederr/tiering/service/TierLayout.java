package com.seederr.tiering.service;

import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.model.Tier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * 两个存储根目录的路径规则
 * 
 * 同一份内容在两层下的相对路径（分类子目录 + 名称）保持一致，
 * 例如 /cache/movies/Tenet 对应 /master/movies/Tenet。
 */
@Component
public class TierLayout {
    
    private final Path cacheRoot;
    private final Path masterRoot;
    
    @Autowired
    public TierLayout(SeederrProperties properties) {
        this(properties.getTiers().getCacheRoot(), properties.getTiers().getMasterRoot());
    }
    
    public TierLayout(Path cacheRoot, Path masterRoot) {
        this.cacheRoot = cacheRoot.toAbsolutePath().normalize();
        this.masterRoot = masterRoot.toAbsolutePath().normalize();
    }
    
    public Path rootOf(Tier tier) {
        return switch (tier) {
            case CACHE -> cacheRoot;
            case MASTER -> masterRoot;
            case UNKNOWN -> throw new IllegalArgumentException("UNKNOWN tier has no root");
        };
    }
    
    /**
     * 按保存路径推导所在层
     */
    public Tier tierOf(Path savePath) {
        if (savePath == null) {
            return Tier.UNKNOWN;
        }
        Path normalized = savePath.toAbsolutePath().normalize();
        if (normalized.startsWith(cacheRoot)) {
            return Tier.CACHE;
        }
        if (normalized.startsWith(masterRoot)) {
            return Tier.MASTER;
        }
        return Tier.UNKNOWN;
    }
    
    /**
     * 把 from 层下的路径映射到 to 层下的同一相对路径
     */
    public Path counterpart(Path path, Tier from, Tier to) {
        Path normalized = path.toAbsolutePath().normalize();
        Path fromRoot = rootOf(from);
        if (!normalized.startsWith(fromRoot)) {
            throw new IllegalArgumentException(path + " is not under " + fromRoot);
        }
        return rootOf(to).resolve(fromRoot.relativize(normalized));
    }
    
    /**
     * 只有严格位于缓存根目录之下、且不落在主存储下的路径才允许删除
     */
    public boolean isRemovable(Path path) {
        if (path == null) {
            return false;
        }
        Path normalized = path.toAbsolutePath().normalize();
        return normalized.startsWith(cacheRoot)
            && !normalized.equals(cacheRoot)
            && !normalized.startsWith(masterRoot);
    }
}
