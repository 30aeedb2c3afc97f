package com.slb.live_backend.modules.viewer.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 邀请人名称缓存，对应 invitor_cache 表。
 */
@Data
public class InvitorCache {
    private Long id;
    private String invitorId;
    private String name;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
