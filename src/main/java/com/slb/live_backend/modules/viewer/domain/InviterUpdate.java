package com.slb.live_backend.modules.viewer.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InviterUpdate {
    private Long viewerId;
    private String inviterName;
    private Boolean invitedByHost;
}
