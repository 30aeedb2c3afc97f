package com.slb.live_backend.modules.viewer.vo;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单次观众同步的统计。
 */
@Data
public class ViewerSyncStatsVo {
    private String livingId;
    private String traceId;

    private Integer pages;
    private Long totalViewers;
    private Long internalViewers;
    private Long externalViewers;

    private Integer processed;
    private Integer successCount;
    private Integer errorCount;
    private Integer created;
    private Integer updated;
    private Integer backfilled;
    private Integer remoteLookups;
    private Integer resolutionMisses;

    private String lastError;
    private LocalDateTime lastErrorTime;
    private LocalDateTime lastSyncTime;
    private Long durationMs;
}
