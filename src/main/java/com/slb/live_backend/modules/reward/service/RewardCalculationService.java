package com.slb.live_backend.modules.reward.service;

import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.modules.reward.config.RewardProperties;
import com.slb.live_backend.modules.reward.domain.RewardEvaluation;
import com.slb.live_backend.modules.reward.dto.RewardCalculateDto;
import com.slb.live_backend.modules.reward.dto.SessionRewardRule;
import com.slb.live_backend.modules.reward.entity.LiveRewardRecord;
import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import com.slb.live_backend.modules.reward.vo.RewardCalculationResultVo;
import com.slb.live_backend.modules.viewer.domain.SignAggregateRow;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.mapper.LiveSignRecordMapper;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 红包奖励计算：校验请求 → 预聚合签到/观看数据 → 规则判定 → 整批替换落库。
 * 入参不合法抛 {@link BizException}；计算或落库失败通过结果的 success/message 返回。
 */
@Service
@Slf4j
public class RewardCalculationService {

    private static final ZoneId BJT = ZoneId.of("Asia/Shanghai");
    private static final DateTimeFormatter BATCH_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final LiveViewerMapper viewerMapper;
    private final LiveSignRecordMapper signRecordMapper;
    private final RewardRuleEngine ruleEngine;
    private final RewardPersistenceTxService persistenceTxService;
    private final RewardRequestValidator validator;
    private final RewardProperties properties;

    public RewardCalculationService(LiveViewerMapper viewerMapper,
                                    LiveSignRecordMapper signRecordMapper,
                                    RewardRuleEngine ruleEngine,
                                    RewardPersistenceTxService persistenceTxService,
                                    RewardRequestValidator validator,
                                    RewardProperties properties) {
        this.viewerMapper = viewerMapper;
        this.signRecordMapper = signRecordMapper;
        this.ruleEngine = ruleEngine;
        this.persistenceTxService = persistenceTxService;
        this.validator = validator;
        this.properties = properties;
    }

    public RewardCalculationResultVo computeRewards(RewardCalculateDto request) {
        RewardRuleType ruleType = validator.validate(request);
        Map<String, SessionRewardRule> rules = validator.indexRules(request.getSessions());
        String operator = StringUtils.hasText(request.getOperatorId()) ? request.getOperatorId().trim() : properties.getDefaultOperator();
        String batchId = StringUtils.hasText(request.getBatchId())
                ? request.getBatchId().trim()
                : buildBatchId(LocalDateTime.now(BJT), operator, ruleType);

        RewardCalculationResultVo result = new RewardCalculationResultVo();
        result.setBatchId(batchId);
        result.setRuleType(ruleType.getCode());
        result.setSessions(rules.size());
        try {
            List<LiveViewer> viewers = viewerMapper.selectByLivingIds(rules.keySet());
            Map<Long, Integer> signCounts = new HashMap<>();
            for (SignAggregateRow row : signRecordMapper.aggregateValidByLivingIds(rules.keySet())) {
                signCounts.put(row.getViewerId(), row.getSignCount() != null ? row.getSignCount() : 0);
            }

            List<RewardEvaluation> evaluations =
                    ruleEngine.evaluate(viewers, signCounts, rules, ruleType, request.getMinWatchCount());

            LocalDateTime now = LocalDateTime.now(BJT);
            List<LiveRewardRecord> records = new ArrayList<>(evaluations.size());
            List<LiveViewer> viewerUpdates = new ArrayList<>(evaluations.size());
            int eligibleCount = 0;
            BigDecimal total = BigDecimal.ZERO;
            for (RewardEvaluation evaluation : evaluations) {
                records.add(toRecord(evaluation, ruleType, request.getMinWatchCount(), batchId, now));
                viewerUpdates.add(toViewerUpdate(evaluation));
                if (evaluation.eligible()) {
                    eligibleCount++;
                    total = total.add(evaluation.amount());
                }
            }

            persistenceTxService.replace(rules.keySet(), records, viewerUpdates);

            result.setSuccess(true);
            result.setProcessed(evaluations.size());
            result.setEligibleCount(eligibleCount);
            result.setTotalAmount(total);
            result.setMessage("计算完成：共 " + evaluations.size() + " 人，符合条件 " + eligibleCount + " 人");
            log.info("Reward calculation finished (batchId={}, ruleType={}, sessions={}, processed={}, eligible={}, total={})",
                    batchId, ruleType.getCode(), rules.size(), evaluations.size(), eligibleCount, total);
        } catch (RuntimeException ex) {
            log.error("Reward calculation failed (batchId={}, ruleType={}, livingIds={})",
                    batchId, ruleType.getCode(), rules.keySet(), ex);
            result.setSuccess(false);
            result.setProcessed(0);
            result.setEligibleCount(0);
            result.setTotalAmount(BigDecimal.ZERO);
            result.setMessage("计算失败: " + ex.getMessage());
        }
        return result;
    }

    public static String buildBatchId(LocalDateTime at, String operatorId, RewardRuleType ruleType) {
        return at.format(BATCH_TIME) + "-" + operatorId + "-" + ruleType.getCode();
    }

    private LiveRewardRecord toRecord(RewardEvaluation evaluation, RewardRuleType ruleType, int minWatchCount,
                                      String batchId, LocalDateTime now) {
        LiveRewardRecord record = new LiveRewardRecord();
        record.setLivingId(evaluation.viewer().getLivingId());
        record.setViewerId(evaluation.viewer().getId());
        record.setRuleType(ruleType);
        record.setRuleSignCount(evaluation.rule().getRuleSignCount());
        record.setRuleWatchSeconds(evaluation.rule().getRuleWatchSeconds());
        record.setRuleWatchCount(minWatchCount);
        record.setCalculateBatch(batchId);
        record.setRewardAmount(evaluation.amount());
        record.setEligible(evaluation.eligible());
        record.setCreatedTime(now);
        record.setUpdatedTime(now);
        return record;
    }

    private LiveViewer toViewerUpdate(RewardEvaluation evaluation) {
        LiveViewer update = new LiveViewer();
        update.setId(evaluation.viewer().getId());
        update.setRewardEligible(evaluation.eligible());
        update.setRewardAmount(evaluation.amount());
        update.setRewardStatus(evaluation.eligible() ? properties.getStatusEligible() : properties.getStatusIneligible());
        return update;
    }
}
