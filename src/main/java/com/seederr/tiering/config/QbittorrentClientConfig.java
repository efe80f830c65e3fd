package com.seederr.tiering.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

/**
 * qBittorrent WebUI 客户端配置
 */
@Slf4j
@Configuration
public class QbittorrentClientConfig {
    
    @Bean
    public RestClient qbittorrentRestClient(RestClient.Builder builder, SeederrProperties properties) {
        SeederrProperties.Qbittorrent qbit = properties.getQbittorrent();
        
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) qbit.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) qbit.getReadTimeout().toMillis());
        
        // WebUI 的 CSRF 校验要求 Referer 与 Host 一致
        return builder
            .baseUrl(qbit.getBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.REFERER, qbit.getBaseUrl())
            .build();
    }
    
    @Bean
    public Retry qbittorrentRetry(SeederrProperties properties) {
        SeederrProperties.Qbittorrent qbit = properties.getQbittorrent();
        
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(qbit.getRetryAttempts())
            .waitDuration(qbit.getRetryBackoff())
            .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
            .build();
        
        Retry retry = RetryRegistry.of(config).retry("qbittorrent");
        retry.getEventPublisher()
            .onRetry(event -> log.warn("qBittorrent call failed, retry #{} in {}: {}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
        return retry;
    }
}
