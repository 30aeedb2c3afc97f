package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;

import java.util.Map;

/**
 * @param failure 落库失败或超时时的原因；为 null 表示对账正常结束
 */
public record ReconcileResult(ParticipantKind kind,
                              int processed,
                              int created,
                              int updated,
                              int errors,
                              Map<ViewerKey, PendingInvitation> unresolvedInvitations,
                              String failure) {

    public boolean isFailed() {
        return failure != null;
    }
}
