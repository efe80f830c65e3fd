package com.seederr.tiering.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.seederr.tiering.config.SeederrProperties;
import com.seederr.tiering.constant.TieringConstants;
import com.seederr.tiering.exception.SourceUnavailableException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.function.Supplier;

/**
 * qBittorrent WebUI API v2 客户端
 *
 * 首次调用时登录，会话过期（403）时重新登录一次再重试；
 * 网络类错误按 Retry 配置重试，耗尽后抛出 SourceUnavailableException。
 */
@Slf4j
@Component
public class QbittorrentClient {

    private final RestClient restClient;
    private final Retry retry;
    private final String baseUrl;
    private final String username;
    private final String password;

    private volatile boolean authenticated;
    private volatile String sessionCookie;

    public QbittorrentClient(RestClient qbittorrentRestClient,
                             Retry qbittorrentRetry,
                             SeederrProperties properties) {
        this.restClient = qbittorrentRestClient;
        this.retry = qbittorrentRetry;
        this.baseUrl = properties.getQbittorrent().getBaseUrl();
        this.username = properties.getQbittorrent().getUsername();
        this.password = properties.getQbittorrent().getPassword();
    }

    /**
     * 登录并保存会话 Cookie
     */
    public synchronized void login() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", username);
        form.add("password", password);

        ResponseEntity<String> response = restClient.post()
            .uri(TieringConstants.QBIT_LOGIN_PATH)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .toEntity(String.class);

        String body = response.getBody() == null ? "" : response.getBody().trim();
        if (!TieringConstants.QBIT_LOGIN_OK.equals(body)) {
            authenticated = false;
            log.error("Failed to connect to qBittorrent at {}: invalid credentials", baseUrl);
            throw new SourceUnavailableException("qBittorrent login rejected");
        }

        sessionCookie = extractSessionCookie(response.getHeaders());
        authenticated = true;
        log.info("Successfully connected to qBittorrent API at {}", baseUrl);
    }

    /**
     * 拉取全部种子（原始 JSON 数组）
     */
    public JsonNode listTorrents() {
        try {
            return call("torrents/info", () -> restClient.get()
                .uri(TieringConstants.QBIT_TORRENTS_INFO_PATH)
                .headers(this::applySession)
                .retrieve()
                .body(JsonNode.class));
        } catch (HttpClientErrorException e) {
            throw new SourceUnavailableException("qBittorrent torrents/info rejected: " + e.getStatusCode(), e);
        }
    }

    /**
     * 查询单个种子，客户端不认识该 hash 时返回空数组
     */
    public JsonNode torrentInfo(String hash) {
        try {
            return call("torrents/info", () -> restClient.get()
                .uri(TieringConstants.QBIT_TORRENT_BY_HASH_PATH, hash)
                .headers(this::applySession)
                .retrieve()
                .body(JsonNode.class));
        } catch (HttpClientErrorException e) {
            throw new SourceUnavailableException("qBittorrent torrents/info rejected for " + hash + ": "
                + e.getStatusCode(), e);
        }
    }

    /**
     * 修改保存路径
     *
     * 2xx 只表示移动已进入客户端队列，移动是否完成要再查询种子状态
     *
     * @return 客户端返回 2xx 时为 true；4xx（目录无权限、无法创建等）为 false
     */
    public boolean setLocation(String hash, String location) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hashes", hash);
        form.add("location", location);

        try {
            call("torrents/setLocation", () -> restClient.post()
                .uri(TieringConstants.QBIT_SET_LOCATION_PATH)
                .headers(this::applySession)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .toBodilessEntity());
            return true;
        } catch (HttpClientErrorException e) {
            log.warn("qBittorrent refused setLocation hash={} location={}: {} {}",
                hash, location, e.getStatusCode(), e.getResponseBodyAsString());
            return false;
        }
    }

    private <T> T call(String name, Supplier<T> request) {
        Supplier<T> withSession = () -> {
            if (!authenticated) {
                login();
            }
            try {
                return request.get();
            } catch (HttpClientErrorException.Forbidden e) {
                log.info("qBittorrent session rejected on {}, logging in again", name);
                login();
                return request.get();
            }
        };

        try {
            return Retry.decorateSupplier(retry, withSession).get();
        } catch (HttpClientErrorException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Connection to qBittorrent lost during {}: {}", name, e.getMessage());
            throw new SourceUnavailableException("qBittorrent " + name + " failed: " + e.getMessage(), e);
        }
    }

    private void applySession(HttpHeaders headers) {
        if (sessionCookie != null) {
            headers.add(HttpHeaders.COOKIE, sessionCookie);
        }
    }

    private String extractSessionCookie(HttpHeaders headers) {
        List<String> cookies = headers.get(HttpHeaders.SET_COOKIE);
        if (cookies == null) {
            // 白名单地址免认证时不下发 Cookie
            return null;
        }
        for (String cookie : cookies) {
            String pair = cookie.split(";", 2)[0].trim();
            if (pair.startsWith(TieringConstants.QBIT_SESSION_COOKIE + "=")) {
                return pair;
            }
        }
        return null;
    }
}
