package com.slb.live_backend.modules.reward.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 单场奖励规则：签到次数阈值、观看时长阈值（秒）、该场奖励金额。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionRewardRule {
    @NotBlank
    private String livingId;
    @NotNull
    @Min(0)
    private Integer ruleSignCount;
    @NotNull
    @Min(0)
    private Integer ruleWatchSeconds;
    @NotNull
    @DecimalMin(value = "0")
    private BigDecimal rewardAmount;
}
