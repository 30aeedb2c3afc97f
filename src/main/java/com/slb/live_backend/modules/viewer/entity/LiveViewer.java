package com.slb.live_backend.modules.viewer.entity;

import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 直播观众记录，对应 live_viewers 表；(living_id, participant_kind, participant_id) 唯一。
 */
@Data
public class LiveViewer implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String livingId;
    private String participantId;
    private ParticipantKind participantKind;
    private String name;
    private String department;

    private Integer watchSeconds;
    private Boolean commented;
    private Boolean usedMic;
    private LocalDateTime firstEnterTime;
    private LocalDateTime lastEnterTime;

    private Boolean signedIn;
    private LocalDateTime lastSignTime;
    private Integer signCount;

    private String inviterId;
    private ParticipantKind inviterKind;
    private String inviterName;
    private Boolean invitedByHost;

    private Boolean rewardEligible;
    private BigDecimal rewardAmount;
    private String rewardStatus;

    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
