package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;

/**
 * 单场直播内观众的业务主键。
 */
public record ViewerKey(ParticipantKind kind, String participantId) {

    public static ViewerKey of(ParticipantKind kind, String participantId) {
        return new ViewerKey(kind, participantId);
    }
}
