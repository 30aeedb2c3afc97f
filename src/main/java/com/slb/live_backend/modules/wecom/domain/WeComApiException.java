package com.slb.live_backend.modules.wecom.domain;

public class WeComApiException extends RuntimeException {
    public WeComApiException(String message) {
        super(message);
    }

    public WeComApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
