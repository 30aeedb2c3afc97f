package com.slb.live_backend.modules.reward.entity;

import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 红包奖励计算结果，对应 live_reward_records 表；每个批次每个 (场次, 观众) 一行。
 */
@Data
public class LiveRewardRecord {
    private Long id;
    private String livingId;
    private Long viewerId;
    private RewardRuleType ruleType;
    private Integer ruleSignCount;
    private Integer ruleWatchSeconds;
    private Integer ruleWatchCount;
    private String calculateBatch;
    private BigDecimal rewardAmount;
    private Boolean eligible;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
