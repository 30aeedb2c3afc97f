package com.slb.live_backend.modules.wecom.domain;

import org.springframework.util.StringUtils;

public record ContactLookup(String name, int errcode) {

    public static ContactLookup failed(int errcode) {
        return new ContactLookup(null, errcode);
    }

    public boolean isFound() {
        return errcode == 0 && StringUtils.hasText(name);
    }
}
