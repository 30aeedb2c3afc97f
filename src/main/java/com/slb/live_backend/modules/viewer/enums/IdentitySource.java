package com.slb.live_backend.modules.viewer.enums;

public enum IdentitySource {
    HOST,
    LOCAL_STORE,
    API_PAGE,
    REMOTE_LOOKUP,
    FALLBACK
}
