package com.slb.live_backend.modules.wecom.domain;

import java.util.List;

public record WatchStatPage(List<WatchParticipant> internalUsers,
                            List<WatchParticipant> externalUsers,
                            String nextKey,
                            boolean ending,
                            Integer errcode,
                            String error) {

    public static WatchStatPage failed(Integer errcode, String error) {
        return new WatchStatPage(List.of(), List.of(), null, false, errcode, error != null ? error : "unknown error");
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int size() {
        return internalUsers.size() + externalUsers.size();
    }
}
