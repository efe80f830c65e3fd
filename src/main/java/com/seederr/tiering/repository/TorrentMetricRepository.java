package com.seederr.tiering.repository;

import com.seederr.tiering.entity.TorrentMetricEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 种子历史指标 Repository
 */
@Repository
public interface TorrentMetricRepository extends JpaRepository<TorrentMetricEntity, String> {
    
    /**
     * 删除宽限期之前就不再出现的种子
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM TorrentMetricEntity m WHERE m.lastSeenAt < :cutoff")
    int deleteNotSeenSince(@Param("cutoff") Instant cutoff);
}
