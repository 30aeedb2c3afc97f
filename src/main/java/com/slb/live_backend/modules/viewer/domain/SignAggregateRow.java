package com.slb.live_backend.modules.viewer.domain;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 按 (场次, 观众) 汇总的有效签到。
 */
@Data
public class SignAggregateRow {
    private Long viewerId;
    private String livingId;
    private Integer signCount;
    private LocalDateTime lastSignTime;
}
