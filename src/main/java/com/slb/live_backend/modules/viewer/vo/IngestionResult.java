package com.slb.live_backend.modules.viewer.vo;

/**
 * @param success 是否整体成功；部分成功（后续页失败）仍为 true
 * @param partial 是否只处理了部分分页
 */
public record IngestionResult(boolean success, boolean partial, String message, ViewerSyncStatsVo stats) {

    public static IngestionResult failed(String message, ViewerSyncStatsVo stats) {
        return new IngestionResult(false, false, message, stats);
    }
}
