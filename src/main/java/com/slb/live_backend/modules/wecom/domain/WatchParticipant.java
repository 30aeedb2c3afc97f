package com.slb.live_backend.modules.wecom.domain;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

/**
 * 观看明细中的单个观众，已从接口的原始 JSON 归一化。
 * 必填字段缺失的记录仍会被发布，由对账侧计入错误数。
 */
public record WatchParticipant(String participantId,
                               ParticipantKind kind,
                               String name,
                               int watchSeconds,
                               boolean commented,
                               boolean usedMic,
                               LocalDateTime firstEnterTime,
                               LocalDateTime lastEnterTime,
                               String inviterId,
                               ParticipantKind inviterKind) {

    public void validate() {
        if (!StringUtils.hasText(participantId)) {
            throw new IllegalArgumentException("participant id missing (kind=" + kind + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("participant kind missing (id=" + participantId + ")");
        }
        if (watchSeconds < 0) {
            throw new IllegalArgumentException("negative watch seconds (id=" + participantId + ")");
        }
    }

    public boolean hasInviter() {
        return StringUtils.hasText(inviterId);
    }
}
