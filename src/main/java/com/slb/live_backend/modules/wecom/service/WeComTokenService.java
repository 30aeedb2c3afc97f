package com.slb.live_backend.modules.wecom.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.live_backend.modules.wecom.config.WeComProperties;
import com.slb.live_backend.modules.wecom.domain.WeComApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * access_token 进程内缓存：过期前 {@code tokenRefreshAheadSeconds} 秒刷新，
 * 接口返回 40014/42001 时由调用方强制刷新。
 */
@Service
@Slf4j
public class WeComTokenService {

    private static final int INVALID_TOKEN = 40014;
    private static final int TOKEN_EXPIRED = 42001;

    private final WeComProperties properties;
    private final WebClient http;
    private final ObjectMapper objectMapper;
    private final AtomicReference<CachedToken> cached = new AtomicReference<>();

    record CachedToken(String value, Instant expiresAt) {
    }

    public WeComTokenService(WebClient.Builder builder, WeComProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.http = builder.build();
    }

    public static boolean isTokenError(int errcode) {
        return errcode == INVALID_TOKEN || errcode == TOKEN_EXPIRED;
    }

    public String getToken() {
        return getToken(false);
    }

    public synchronized String getToken(boolean forceRefresh) {
        CachedToken current = cached.get();
        if (!forceRefresh && current != null && Instant.now().isBefore(current.expiresAt())) {
            return current.value();
        }
        CachedToken refreshed = requestToken();
        cached.set(refreshed);
        log.info("WeCom access token refreshed (forced={}, expiresAt={})", forceRefresh, refreshed.expiresAt());
        return refreshed.value();
    }

    private CachedToken requestToken() {
        if (!StringUtils.hasText(properties.getCorpId()) || !StringUtils.hasText(properties.getCorpSecret())) {
            throw new WeComApiException("WeCom corpId/corpSecret not configured");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + properties.getEndpoints().getToken())
                .queryParam("corpid", properties.getCorpId())
                .queryParam("corpsecret", properties.getCorpSecret())
                .build()
                .toUri();
        String body;
        try {
            body = http.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(Math.max(1000L, properties.getLimits().getTimeoutMs())))
                    .block();
        } catch (Exception ex) {
            throw new WeComApiException("WeCom token request failed: " + ex.getMessage(), ex);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            int errcode = root.path("errcode").asInt(0);
            if (errcode != 0) {
                throw new WeComApiException("WeCom token rejected: errcode=" + errcode
                        + ", errmsg=" + root.path("errmsg").asText());
            }
            String token = root.path("access_token").asText(null);
            long expiresIn = root.path("expires_in").asLong(7200L);
            long effective = Math.max(60L, expiresIn - properties.getTokenRefreshAheadSeconds());
            return new CachedToken(token, Instant.now().plusSeconds(effective));
        } catch (WeComApiException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new WeComApiException("WeCom token response malformed", ex);
        }
    }
}
