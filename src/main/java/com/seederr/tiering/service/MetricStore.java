package com.seederr.tiering.service;

import com.seederr.tiering.model.MetricRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 种子历史指标存储
 *
 * 所有方法在存储不可用时抛出 {@link com.seederr.tiering.exception.StoreUnavailableException}。
 */
public interface MetricStore {

    Optional<MetricRecord> get(String hash);

    /**
     * 批量读取，不存在的 hash 不出现在结果中
     */
    Map<String, MetricRecord> getAll(Collection<String> hashes);

    void upsert(MetricRecord record);

    void upsertAll(Collection<MetricRecord> records);

    void delete(String hash);

    /**
     * 删除最近观测时间早于 cutoff 的记录
     *
     * @return 删除条数
     */
    int pruneNotSeenSince(Instant cutoff);

    /**
     * 记录总数，启动时用作连通性探测
     */
    long count();
}
