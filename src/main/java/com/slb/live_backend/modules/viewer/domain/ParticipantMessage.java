package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.wecom.domain.WatchParticipant;

/**
 * 队列消息；{@link #END} 为流结束标记。
 */
public record ParticipantMessage(WatchParticipant participant, int page) {

    public static final ParticipantMessage END = new ParticipantMessage(null, -1);

    public boolean isEnd() {
        return this == END;
    }
}
