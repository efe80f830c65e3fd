package com.seederr.tiering.service;

import com.seederr.tiering.entity.TorrentMetricEntity;
import com.seederr.tiering.exception.StoreUnavailableException;
import com.seederr.tiering.model.MetricRecord;
import com.seederr.tiering.repository.TorrentMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 基于 JPA 的指标存储
 * 
 * 事务边界在 Repository 方法上，提交失败同样会被包装为 StoreUnavailableException。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMetricStore implements MetricStore {
    
    private final TorrentMetricRepository repository;
    
    @Override
    public Optional<MetricRecord> get(String hash) {
        return access("get", () -> repository.findById(hash).map(this::toRecord));
    }
    
    @Override
    public Map<String, MetricRecord> getAll(Collection<String> hashes) {
        if (hashes.isEmpty()) {
            return Map.of();
        }
        return access("getAll", () -> repository.findAllById(hashes).stream()
            .map(this::toRecord)
            .collect(Collectors.toMap(MetricRecord::hash, Function.identity())));
    }
    
    @Override
    public void upsert(MetricRecord record) {
        access("upsert", () -> repository.save(toEntity(record)));
    }
    
    @Override
    public void upsertAll(Collection<MetricRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        access("upsertAll", () -> repository.saveAll(records.stream().map(this::toEntity).toList()));
        log.debug("Upserted {} metric records", records.size());
    }
    
    @Override
    public void delete(String hash) {
        access("delete", () -> {
            repository.deleteById(hash);
            return null;
        });
    }
    
    @Override
    public int pruneNotSeenSince(Instant cutoff) {
        int removed = access("prune", () -> repository.deleteNotSeenSince(cutoff));
        if (removed > 0) {
            log.info("Pruned {} stale metric records not seen since {}", removed, cutoff);
        }
        return removed;
    }
    
    @Override
    public long count() {
        return access("count", repository::count);
    }
    
    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metrics store " + operation + " failed: " + e.getMessage(), e);
        }
    }
    
    private MetricRecord toRecord(TorrentMetricEntity entity) {
        return new MetricRecord(
            entity.getHash(),
            entity.getSmoothedRateGbDay(),
            entity.getRateGbDay(),
            entity.getLastUploaded(),
            entity.getFirstSeenAt(),
            entity.getLastSeenAt()
        );
    }
    
    private TorrentMetricEntity toEntity(MetricRecord record) {
        TorrentMetricEntity entity = new TorrentMetricEntity();
        entity.setHash(record.hash());
        entity.setSmoothedRateGbDay(record.smoothedRateGbPerDay());
        entity.setRateGbDay(record.lastRateGbPerDay());
        entity.setLastUploaded(record.lastUploadedBytes());
        entity.setFirstSeenAt(record.firstSeenAt());
        entity.setLastSeenAt(record.lastSeenAt());
        return entity;
    }
}
