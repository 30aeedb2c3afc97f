package com.slb.live_backend.modules.living.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 直播场次，对应 livings 表。本服务只读取。
 */
@Data
public class Living implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String livingId;
    private String theme;
    private String anchorUserId;
    private String anchorName;
    private LocalDateTime livingStart;
    private Integer livingDuration;
    private Integer viewerNum;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
