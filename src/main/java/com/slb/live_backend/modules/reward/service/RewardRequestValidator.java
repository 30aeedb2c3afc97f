package com.slb.live_backend.modules.reward.service;

import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.modules.reward.dto.RewardCalculateDto;
import com.slb.live_backend.modules.reward.dto.SessionRewardRule;
import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 奖励请求校验。控制器已做注解校验，这里再校验一遍，服务也可能被其它 Bean 直接调用。
 */
@Component
public class RewardRequestValidator {

    public RewardRuleType validate(RewardCalculateDto request) {
        if (request == null || request.getSessions() == null || request.getSessions().isEmpty()) {
            throw new BizException("请至少选择一场直播");
        }
        RewardRuleType ruleType = RewardRuleType.fromCode(request.getRuleType())
                .orElseThrow(() -> new BizException("未知的奖励规则: " + request.getRuleType()));
        if (request.getMinWatchCount() == null || request.getMinWatchCount() < 0) {
            throw new BizException("最少观看场次不能为负数");
        }
        for (SessionRewardRule rule : request.getSessions()) {
            if (rule == null || !StringUtils.hasText(rule.getLivingId())) {
                throw new BizException("直播 ID 不能为空");
            }
            if (rule.getRuleSignCount() == null || rule.getRuleSignCount() < 0
                    || rule.getRuleWatchSeconds() == null || rule.getRuleWatchSeconds() < 0) {
                throw new BizException("签到次数与观看时长阈值不能为负数: " + rule.getLivingId());
            }
            if (rule.getRewardAmount() == null || rule.getRewardAmount().signum() < 0) {
                throw new BizException("奖励金额不能为负数: " + rule.getLivingId());
            }
        }
        return ruleType;
    }

    /**
     * livingId → 规则，保持请求顺序；同一场次出现两次视为非法请求。
     */
    public Map<String, SessionRewardRule> indexRules(List<SessionRewardRule> sessions) {
        Map<String, SessionRewardRule> rules = new LinkedHashMap<>();
        for (SessionRewardRule rule : sessions) {
            if (rules.put(rule.getLivingId().trim(), rule) != null) {
                throw new BizException("直播场次重复: " + rule.getLivingId());
            }
        }
        return rules;
    }
}
