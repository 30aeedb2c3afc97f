package com.slb.live_backend.modules.reward.service;

import com.slb.live_backend.modules.reward.domain.RewardEvaluation;
import com.slb.live_backend.modules.reward.dto.SessionRewardRule;
import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 纯计算，不访问数据库：输入所选场次的观众与签到汇总，输出每个 (场次, 观众) 的判定。
 */
@Component
public class RewardRuleEngine {

    /**
     * @param viewers          所选场次的全部观众
     * @param signCounts       viewerId → 有效签到次数；缺失时回退到观众表上的签到计数
     * @param rules            livingId → 该场规则
     * @param minWatchCount    跨场次最少出现场数（全局阈值）
     */
    public List<RewardEvaluation> evaluate(List<LiveViewer> viewers,
                                           Map<Long, Integer> signCounts,
                                           Map<String, SessionRewardRule> rules,
                                           RewardRuleType ruleType,
                                           int minWatchCount) {
        Map<ViewerKey, Set<String>> sessionsByParticipant = new HashMap<>();
        for (LiveViewer viewer : viewers) {
            if (rules.containsKey(viewer.getLivingId())) {
                sessionsByParticipant
                        .computeIfAbsent(ViewerKey.of(viewer.getParticipantKind(), viewer.getParticipantId()), k -> new HashSet<>())
                        .add(viewer.getLivingId());
            }
        }

        List<RewardEvaluation> evaluations = new ArrayList<>(viewers.size());
        for (LiveViewer viewer : viewers) {
            SessionRewardRule rule = rules.get(viewer.getLivingId());
            if (rule == null) {
                continue;
            }
            Integer detailCount = signCounts.get(viewer.getId());
            int signCount = detailCount != null ? detailCount : nz(viewer.getSignCount());
            int watchSeconds = nz(viewer.getWatchSeconds());
            int watchCount = sessionsByParticipant
                    .getOrDefault(ViewerKey.of(viewer.getParticipantKind(), viewer.getParticipantId()), Set.of())
                    .size();

            boolean eligible = ruleType.isSatisfied(
                    signCount >= nz(rule.getRuleSignCount()),
                    watchSeconds >= nz(rule.getRuleWatchSeconds()),
                    watchCount >= minWatchCount);
            BigDecimal amount = eligible && rule.getRewardAmount() != null ? rule.getRewardAmount() : BigDecimal.ZERO;
            evaluations.add(new RewardEvaluation(viewer, rule, signCount, watchSeconds, watchCount, eligible, amount));
        }
        return evaluations;
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
