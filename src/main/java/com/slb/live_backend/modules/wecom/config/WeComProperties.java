package com.slb.live_backend.modules.wecom.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.wecom")
@Data
public class WeComProperties {

    private String corpId;
    private String corpSecret;
    private String baseUrl = "https://qyapi.weixin.qq.com/cgi-bin";
    /**
     * 观看明细数据类型：1 直播观看，2 回放观看。
     */
    private int watchStatDataType = 1;
    /**
     * access_token 提前刷新秒数，避免临界过期。
     */
    private long tokenRefreshAheadSeconds = 300L;
    private Endpoints endpoints = new Endpoints();
    private Limits limits = new Limits();

    @Data
    public static class Endpoints {
        private String token = "/gettoken";
        private String watchStat = "/living/get_watch_stat";
        private String user = "/user/get";
        private String externalContact = "/externalcontact/get";
    }

    @Data
    public static class Limits {
        private double perHostQps = 5.0d;
        private int maxRetries = 2;
        private long timeoutMs = 30_000L;
    }
}
