package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import lombok.Data;

@Data
public class ViewerIdRow {
    private Long id;
    private ParticipantKind participantKind;
    private String participantId;
}
