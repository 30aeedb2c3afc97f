package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.vo.ViewerSyncStatsVo;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class ViewerSyncStatus {

    private static final ZoneId BJT = ZoneId.of("Asia/Shanghai");
    private final AtomicReference<SyncStatus> lastSync = new AtomicReference<>();

    public record SyncStatus(LocalDateTime at, String status, String detail, ViewerSyncStatsVo stats) {
    }

    public void recordSync(String status, String detail, ViewerSyncStatsVo stats) {
        lastSync.set(new SyncStatus(LocalDateTime.now(BJT), status, detail, stats));
    }

    public SyncStatus getLastSync() {
        return lastSync.get();
    }
}
