package com.slb.live_backend.modules.wecom.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.slb.live_backend.modules.wecom.config.WeComProperties;
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import com.slb.live_backend.modules.wecom.domain.WatchStatPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class WeComClient implements LivePlatformClient {

    private static final int ERROR_BODY_MAX = 300;

    private final WeComProperties properties;
    private final WeComTokenService tokenService;
    private final WeComParser parser;
    private final ObjectMapper objectMapper;
    private final WebClient http;
    private final RateLimiter limiter;

    public WeComClient(WebClient.Builder builder,
                       WeComProperties properties,
                       WeComTokenService tokenService,
                       WeComParser parser,
                       ObjectMapper objectMapper) {
        this.properties = properties;
        this.tokenService = tokenService;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.http = builder
                .defaultHeader(HttpHeaders.USER_AGENT, "LiveBackend/WeComClient")
                .build();
        double permitsPerSecond = Math.max(0.1d, properties.getLimits().getPerHostQps());
        this.limiter = RateLimiter.create(permitsPerSecond);
    }

    @Override
    public WatchStatPage fetchWatchStat(String livingId, String nextKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("livingid", livingId);
        payload.put("next_key", nextKey == null ? "" : nextKey);
        payload.put("data_type", properties.getWatchStatDataType());
        WeComRawResponse response = callWithTokenRetry(properties.getEndpoints().getWatchStat(), Map.of(), payload);
        if (!response.isSuccess()) {
            return WatchStatPage.failed(response.statusCode(), "status=" + response.statusCode() + ", body=" + response.errorBody());
        }
        return parser.parseWatchStat(response.body());
    }

    @Override
    public ContactLookup lookupUser(String userId) {
        WeComRawResponse response = callWithTokenRetry(properties.getEndpoints().getUser(), Map.of("userid", userId), null);
        return response.isSuccess() ? parser.parseContact(response.body()) : ContactLookup.failed(-1);
    }

    @Override
    public ContactLookup lookupExternalContact(String externalUserId) {
        WeComRawResponse response = callWithTokenRetry(properties.getEndpoints().getExternalContact(),
                Map.of("external_userid", externalUserId), null);
        return response.isSuccess() ? parser.parseContact(response.body()) : ContactLookup.failed(-1);
    }

    /**
     * token 失效（40014/42001）时强制刷新并重试一次。
     */
    private WeComRawResponse callWithTokenRetry(String endpoint, Map<String, String> query, Map<String, Object> payload) {
        WeComRawResponse response = call(endpoint, tokenService.getToken(), query, payload);
        if (response.isSuccess() && WeComTokenService.isTokenError(WeComParser.readErrcode(objectMapper, response.body()))) {
            log.warn("WeCom access token rejected, refreshing and retrying once (endpoint={})", endpoint);
            response = call(endpoint, tokenService.getToken(true), query, payload);
        }
        return response;
    }

    private WeComRawResponse call(String endpoint, String token, Map<String, String> query, Map<String, Object> payload) {
        limiter.acquire();
        URI uri = buildUri(endpoint, token, query);
        Duration timeout = Duration.ofMillis(Math.max(1000L, properties.getLimits().getTimeoutMs()));
        Retry retry = Retry.backoff(Math.max(0, properties.getLimits().getMaxRetries()), Duration.ofMillis(200))
                .maxBackoff(Duration.ofSeconds(3))
                .filter(this::isRetryable);
        try {
            WebClient.RequestHeadersSpec<?> request = payload == null
                    ? http.get().uri(uri)
                    : http.post().uri(uri).contentType(MediaType.APPLICATION_JSON).bodyValue(payload);
            String body = request
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .retryWhen(retry)
                    .block();
            return WeComRawResponse.success(body, Instant.now());
        } catch (WebClientResponseException ex) {
            logRequestError(endpoint, ex);
            return WeComRawResponse.error(ex.getStatusCode().value(), trimBody(ex.getResponseBodyAsString()));
        } catch (Exception ex) {
            logRequestError(endpoint, ex);
            return WeComRawResponse.error(null, trimBody(ex.getMessage()));
        }
    }

    private URI buildUri(String endpoint, String token, Map<String, String> query) {
        String base = StringUtils.hasText(properties.getBaseUrl()) ? properties.getBaseUrl() : "";
        String normalizedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String normalizedEndpoint = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(normalizedBase + normalizedEndpoint)
                .queryParam("access_token", token);
        query.forEach(builder::queryParam);
        return builder.build().encode().toUri();
    }

    private boolean isRetryable(Throwable err) {
        if (err instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return true;
    }

    private void logRequestError(String endpoint, Throwable err) {
        Integer statusCode = null;
        if (err instanceof WebClientResponseException wcre) {
            statusCode = wcre.getStatusCode().value();
        }
        log.warn("WeCom API request failed (endpoint={}, statusCode={}, message={})",
                endpoint, statusCode, err.getMessage());
    }

    private String trimBody(String body) {
        if (!StringUtils.hasText(body)) {
            return null;
        }
        String trimmed = body.trim();
        if (trimmed.length() <= ERROR_BODY_MAX) {
            return trimmed;
        }
        return trimmed.substring(0, ERROR_BODY_MAX) + "...";
    }

    public record WeComRawResponse(String body, Instant fetchedAt, Integer statusCode, String errorBody) {

        static WeComRawResponse success(String body, Instant fetchedAt) {
            return new WeComRawResponse(StringUtils.hasText(body) ? body : null,
                    fetchedAt != null ? fetchedAt : Instant.now(), 200, null);
        }

        static WeComRawResponse error(Integer statusCode, String errorBody) {
            return new WeComRawResponse(null, Instant.now(), statusCode, errorBody);
        }

        public boolean isSuccess() {
            return statusCode != null && statusCode >= 200 && statusCode < 300;
        }
    }
}
