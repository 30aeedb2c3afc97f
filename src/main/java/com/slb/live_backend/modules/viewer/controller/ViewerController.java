package com.slb.live_backend.modules.viewer.controller;

import com.slb.live_backend.common.api.ApiResponse;
import com.slb.live_backend.modules.viewer.service.SignInfoService;
import com.slb.live_backend.modules.viewer.service.ViewerIngestionService;
import com.slb.live_backend.modules.viewer.service.ViewerStatsService;
import com.slb.live_backend.modules.viewer.service.ViewerSyncStatus;
import com.slb.live_backend.modules.viewer.vo.IngestionResult;
import com.slb.live_backend.modules.viewer.vo.SignRefreshResultVo;
import com.slb.live_backend.modules.viewer.vo.ViewerStatisticsVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/livings")
@Tag(name = "直播/观众", description = "观众数据同步、签到汇总与统计")
public class ViewerController {

    private final ViewerIngestionService ingestionService;
    private final SignInfoService signInfoService;
    private final ViewerStatsService statsService;
    private final ViewerSyncStatus syncStatus;

    public ViewerController(ViewerIngestionService ingestionService,
                            SignInfoService signInfoService,
                            ViewerStatsService statsService,
                            ViewerSyncStatus syncStatus) {
        this.ingestionService = ingestionService;
        this.signInfoService = signInfoService;
        this.statsService = statsService;
        this.syncStatus = syncStatus;
    }

    @PostMapping("/{livingId}/viewers/sync")
    @Operation(
            summary = "同步观众数据",
            description = """
                    分页拉取企业微信观看明细并写入 live_viewers：已有观众更新观看数据，新观众插入。
                    第一页失败返回 success=false；后续页失败返回 partial=true，已获取的数据照常入库。
                    """
    )
    public ApiResponse<IngestionResult> sync(
            @Parameter(description = "直播 ID", required = true) @PathVariable String livingId) {
        return ApiResponse.ok(ingestionService.processViewerInfo(livingId));
    }

    @GetMapping("/{livingId}/viewers/statistics")
    @Operation(summary = "观众统计")
    public ApiResponse<ViewerStatisticsVo> statistics(@PathVariable String livingId) {
        return ApiResponse.ok(statsService.getStatistics(livingId));
    }

    @PostMapping("/{livingId}/viewers/sign-refresh")
    @Operation(summary = "按签到明细刷新观众签到信息")
    public ApiResponse<SignRefreshResultVo> refreshSignInfo(@PathVariable String livingId) {
        return ApiResponse.ok(signInfoService.refreshSignInfo(livingId));
    }

    @GetMapping("/viewers/sync-status")
    @Operation(summary = "最近一次观众同步状态")
    public ApiResponse<ViewerSyncStatus.SyncStatus> syncStatus() {
        return ApiResponse.ok(syncStatus.getLastSync());
    }
}
