package com.seederr.tiering.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.seederr.tiering.exception.SourceUnavailableException;
import com.seederr.tiering.model.PayloadSnapshot;
import com.seederr.tiering.model.Tier;
import com.seederr.tiering.service.TierLayout;
import com.seederr.tiering.service.TorrentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * qBittorrent 实现的种子来源
 *
 * 把 /api/v2/torrents/info 的 JSON 转成强类型快照。缺少必填字段或字段格式错误的条目
 * 只丢弃该条目并告警，不影响整轮调度。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QbittorrentTorrentSource implements TorrentSource {

    private final QbittorrentClient client;
    private final TierLayout layout;

    @Override
    public List<PayloadSnapshot> listPayloads() {
        JsonNode torrents = client.listTorrents();
        if (torrents == null || !torrents.isArray()) {
            throw new SourceUnavailableException("qBittorrent torrents/info did not return a JSON array");
        }

        List<PayloadSnapshot> payloads = new ArrayList<>(torrents.size());
        int rejected = 0;
        for (JsonNode node : torrents) {
            Optional<PayloadSnapshot> payload = toSnapshot(node);
            if (payload.isPresent()) {
                payloads.add(payload.get());
            } else {
                rejected++;
            }
        }

        if (rejected > 0) {
            log.warn("Rejected {} malformed torrent entries out of {}", rejected, torrents.size());
        }
        log.info("Retrieved {} torrents from qBittorrent for processing", payloads.size());
        return payloads;
    }

    @Override
    public Optional<PayloadSnapshot> findPayload(String hash) {
        JsonNode torrents = client.torrentInfo(hash);
        if (torrents == null || !torrents.isArray()) {
            throw new SourceUnavailableException("qBittorrent torrents/info did not return a JSON array");
        }
        if (torrents.isEmpty()) {
            return Optional.empty();
        }
        return toSnapshot(torrents.get(0));
    }

    @Override
    public boolean setSaveLocation(String hash, Path newSavePath) {
        return client.setLocation(hash, newSavePath.toString());
    }

    Optional<PayloadSnapshot> toSnapshot(JsonNode node) {
        String hash = text(node, "hash");
        String savePath = text(node, "save_path");
        String contentPath = text(node, "content_path");
        if (hash == null || hash.isBlank() || savePath == null || contentPath == null
            || !isNumber(node, "size")) {
            log.warn("Skipping torrent entry with missing fields: hash={}, name={}", hash, text(node, "name"));
            return Optional.empty();
        }

        try {
            Path save = Path.of(savePath);
            Path content = Path.of(contentPath);
            Tier tier = layout.tierOf(save);
            return Optional.of(PayloadSnapshot.builder()
                .hash(hash.toLowerCase())
                .name(Optional.ofNullable(text(node, "name")).orElse(hash))
                .category(Optional.ofNullable(text(node, "category")).orElse(""))
                .sizeBytes(node.get("size").asLong())
                .seeders(nonNegative(node, "num_complete"))
                .leechers(nonNegative(node, "num_incomplete"))
                .uploadRateBytesPerSecond(Math.max(0, node.path("upspeed").asLong(0)))
                .uploadedBytes(Math.max(0, node.path("uploaded").asLong(0)))
                .savePath(save)
                .contentPath(content)
                .progress(node.path("progress").asDouble(0.0))
                .state(text(node, "state"))
                .tier(tier)
                .build());
        } catch (InvalidPathException e) {
            log.warn("Skipping torrent {} with invalid path: {}", hash, e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean isNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() && value.asLong() >= 0;
    }

    private static int nonNegative(JsonNode node, String field) {
        return Math.max(0, node.path(field).asInt(0));
    }
}
