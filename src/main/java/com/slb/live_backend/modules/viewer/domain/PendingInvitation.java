package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;

/**
 * 同步过程中未能解析名称的邀请人，留给回填阶段处理。
 */
public record PendingInvitation(String inviterId, ParticipantKind inviterKind) {
}
