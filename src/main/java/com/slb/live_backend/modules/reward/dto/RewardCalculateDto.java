package com.slb.live_backend.modules.reward.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class RewardCalculateDto {

    @NotEmpty
    @Valid
    private List<SessionRewardRule> sessions;

    @NotBlank
    @Schema(description = "规则：sign / watch / count / sign-watch / sign-count / watch-count / all-or / all-and", example = "sign-watch")
    private String ruleType;

    @NotNull
    @Min(0)
    @Schema(description = "所选场次中最少观看场数")
    private Integer minWatchCount;

    @Schema(description = "操作人，用于生成批次号；为空时取默认值")
    private String operatorId;

    @Schema(description = "指定批次号；为空时按 yyyyMMddHHmmss-操作人-规则 生成")
    private String batchId;
}
