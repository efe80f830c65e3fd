package com.seederr.tiering.service;

import com.seederr.tiering.model.PayloadSnapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 种子来源（BT 客户端）
 */
public interface TorrentSource {

    /**
     * 拉取所有种子的快照
     *
     * @throws com.seederr.tiering.exception.SourceUnavailableException 客户端不可达
     */
    List<PayloadSnapshot> listPayloads();

    /**
     * 重新读取单个种子的当前状态，客户端已不认识该 hash 时返回空
     *
     * @throws com.seederr.tiering.exception.SourceUnavailableException 客户端不可达
     */
    Optional<PayloadSnapshot> findPayload(String hash);

    /**
     * 修改种子保存路径
     *
     * @return 客户端接受了移动请求时返回 true（移动可能仍在进行）
     * @throws com.seederr.tiering.exception.SourceUnavailableException 客户端不可达
     */
    boolean setSaveLocation(String hash, Path newSavePath);
}
