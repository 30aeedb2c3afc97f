package com.slb.live_backend.modules.reward.domain;

import com.slb.live_backend.modules.reward.dto.SessionRewardRule;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;

import java.math.BigDecimal;

/**
 * 单个 (场次, 观众) 的判定结果。
 */
public record RewardEvaluation(LiveViewer viewer,
                               SessionRewardRule rule,
                               int signCount,
                               int watchSeconds,
                               int watchCount,
                               boolean eligible,
                               BigDecimal amount) {
}
