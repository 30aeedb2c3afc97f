package com.slb.live_backend.modules.reward.controller;

import com.slb.live_backend.common.api.ApiResponse;
import com.slb.live_backend.modules.reward.dto.RewardCalculateDto;
import com.slb.live_backend.modules.reward.service.RewardCalculationService;
import com.slb.live_backend.modules.reward.service.RewardConsistencyService;
import com.slb.live_backend.modules.reward.vo.RewardCalculationResultVo;
import com.slb.live_backend.modules.reward.vo.RewardConsistencyReportVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/rewards")
@Tag(name = "直播/红包奖励", description = "按规则计算观众红包奖励")
public class RewardController {

    private final RewardCalculationService calculationService;
    private final RewardConsistencyService consistencyService;

    public RewardController(RewardCalculationService calculationService,
                            RewardConsistencyService consistencyService) {
        this.calculationService = calculationService;
        this.consistencyService = consistencyService;
    }

    @PostMapping("/calculate")
    @Operation(
            summary = "计算红包奖励",
            description = """
                    对所选场次按规则重新计算：先删除这些场次已有的奖励记录，再写入本批次结果并更新观众奖励状态。
                    """
    )
    public ApiResponse<RewardCalculationResultVo> calculate(@Valid @RequestBody RewardCalculateDto request) {
        return ApiResponse.ok(calculationService.computeRewards(request));
    }

    @PostMapping("/consistency-check")
    @Operation(summary = "检查已有奖励记录与当前规则是否一致")
    public ApiResponse<RewardConsistencyReportVo> consistencyCheck(@Valid @RequestBody RewardCalculateDto request) {
        return ApiResponse.ok(consistencyService.check(request));
    }
}
