package com.slb.live_backend.modules.reward.vo;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class RewardCalculationResultVo {
    private boolean success;
    private String message;
    private String batchId;
    private String ruleType;
    private Integer sessions;
    private Integer processed;
    private Integer eligibleCount;
    private BigDecimal totalAmount;
}
