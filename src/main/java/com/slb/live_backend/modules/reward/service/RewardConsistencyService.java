package com.slb.live_backend.modules.reward.service;

import com.slb.live_backend.modules.reward.config.RewardProperties;
import com.slb.live_backend.modules.reward.dto.RewardCalculateDto;
import com.slb.live_backend.modules.reward.dto.SessionRewardRule;
import com.slb.live_backend.modules.reward.entity.LiveRewardRecord;
import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import com.slb.live_backend.modules.reward.mapper.LiveRewardRecordMapper;
import com.slb.live_backend.modules.reward.vo.RewardConsistencyReportVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 导出前检查：每场抽样若干条已落库的奖励记录，与当前配置的规则比对（规则类型、阈值），
 * 并列出涉及的计算批次。不一致只返回提示。
 */
@Service
@Slf4j
public class RewardConsistencyService {

    private final LiveRewardRecordMapper rewardRecordMapper;
    private final RewardRequestValidator validator;
    private final RewardProperties properties;

    public RewardConsistencyService(LiveRewardRecordMapper rewardRecordMapper,
                                    RewardRequestValidator validator,
                                    RewardProperties properties) {
        this.rewardRecordMapper = rewardRecordMapper;
        this.validator = validator;
        this.properties = properties;
    }

    public RewardConsistencyReportVo check(RewardCalculateDto request) {
        RewardRuleType ruleType = validator.validate(request);
        Map<String, SessionRewardRule> rules = validator.indexRules(request.getSessions());
        int sampleSize = Math.max(1, properties.getConsistencySampleSize());

        RewardConsistencyReportVo report = new RewardConsistencyReportVo();
        int sampled = 0;
        for (Map.Entry<String, SessionRewardRule> entry : rules.entrySet()) {
            String livingId = entry.getKey();
            SessionRewardRule rule = entry.getValue();
            List<LiveRewardRecord> samples = rewardRecordMapper.selectSampleByLivingId(livingId, sampleSize);
            if (samples.isEmpty()) {
                report.getSessionsWithoutRecords().add(livingId);
                continue;
            }
            for (LiveRewardRecord record : samples) {
                sampled++;
                if (record.getCalculateBatch() != null) {
                    report.getBatchIds().add(record.getCalculateBatch());
                }
                compare(report, record, "ruleType", ruleType.getCode(),
                        record.getRuleType() != null ? record.getRuleType().getCode() : null);
                compare(report, record, "ruleSignCount", rule.getRuleSignCount(), record.getRuleSignCount());
                compare(report, record, "ruleWatchSeconds", rule.getRuleWatchSeconds(), record.getRuleWatchSeconds());
                compare(report, record, "ruleWatchCount", request.getMinWatchCount(), record.getRuleWatchCount());
            }
        }
        report.setCheckedSessions(rules.size());
        report.setSampledRecords(sampled);
        report.setConsistent(report.getMismatches().isEmpty() && report.getSessionsWithoutRecords().isEmpty());
        if (!report.isConsistent()) {
            log.warn("Reward records differ from current rule (ruleType={}, mismatches={}, sessionsWithoutRecords={}, batchIds={})",
                    ruleType.getCode(), report.getMismatches().size(), report.getSessionsWithoutRecords(), report.getBatchIds());
        }
        return report;
    }

    private void compare(RewardConsistencyReportVo report, LiveRewardRecord record, String field,
                         Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            report.getMismatches().add(new RewardConsistencyReportVo.Mismatch(
                    record.getLivingId(), record.getViewerId(), field,
                    String.valueOf(expected), String.valueOf(actual)));
        }
    }
}
