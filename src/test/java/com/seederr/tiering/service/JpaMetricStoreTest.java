package com.seederr.tiering.service;

import com.seederr.tiering.exception.StoreUnavailableException;
import com.seederr.tiering.model.MetricRecord;
import com.seederr.tiering.repository.TorrentMetricRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * JPA 指标存储测试（H2）
 */
@DataJpaTest
@Import(JpaMetricStore.class)
class JpaMetricStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private JpaMetricStore store;

    @Test
    @DisplayName("写入后读取，重复写入为更新")
    void testUpsertAndGet() {
        store.upsert(new MetricRecord("aaa", 1.5, 2.0, 1000, NOW, NOW));
        store.upsert(new MetricRecord("aaa", 3.0, 4.0, 2000, NOW, NOW.plusSeconds(60)));

        MetricRecord record = store.get("aaa").orElseThrow();
        assertEquals(3.0, record.smoothedRateGbPerDay());
        assertEquals(2000, record.lastUploadedBytes());
        assertEquals(NOW.plusSeconds(60), record.lastSeenAt());
        assertEquals(1, store.count());
    }

    @Test
    @DisplayName("批量读取只返回存在的记录")
    void testGetAll() {
        store.upsertAll(List.of(
            new MetricRecord("aaa", 1, 1, 0, NOW, NOW),
            new MetricRecord("bbb", 2, 2, 0, NOW, NOW)));

        Map<String, MetricRecord> records = store.getAll(List.of("aaa", "bbb", "ccc"));

        assertEquals(2, records.size());
        assertEquals(2.0, records.get("bbb").smoothedRateGbPerDay());
        assertTrue(store.getAll(List.of()).isEmpty());
    }

    @Test
    @DisplayName("清理宽限期之前不再出现的记录")
    void testPrune() {
        store.upsertAll(List.of(
            new MetricRecord("stale", 1, 1, 0, NOW, NOW.minus(Duration.ofDays(10))),
            new MetricRecord("fresh", 1, 1, 0, NOW, NOW)));

        int removed = store.pruneNotSeenSince(NOW.minus(Duration.ofDays(7)));

        assertEquals(1, removed);
        assertTrue(store.get("stale").isEmpty());
        assertTrue(store.get("fresh").isPresent());
    }

    @Test
    @DisplayName("删除单条记录")
    void testDelete() {
        store.upsert(new MetricRecord("aaa", 1, 1, 0, NOW, NOW));

        store.delete("aaa");

        assertTrue(store.get("aaa").isEmpty());
    }

    @Test
    @DisplayName("数据库异常包装为 StoreUnavailableException")
    void testDataAccessFailureIsWrapped() {
        TorrentMetricRepository repository = mock(TorrentMetricRepository.class);
        when(repository.findAllById(anyIterable()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        JpaMetricStore failing = new JpaMetricStore(repository);

        assertThrows(StoreUnavailableException.class, () -> failing.getAll(List.of("aaa")));
    }
}
