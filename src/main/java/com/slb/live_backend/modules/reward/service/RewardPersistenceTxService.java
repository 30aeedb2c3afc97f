package com.slb.live_backend.modules.reward.service;

import com.google.common.collect.Lists;
import com.slb.live_backend.modules.reward.config.RewardProperties;
import com.slb.live_backend.modules.reward.entity.LiveRewardRecord;
import com.slb.live_backend.modules.reward.mapper.LiveRewardRecordMapper;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * 奖励结果落库的事务实现（public 方法 + 由外部 Bean 调用，@Transactional 才生效）。
 * 先删所选场次的旧记录，再插入本批次，最后回写观众的奖励字段；任一步失败整体回滚。
 */
@Service
@Slf4j
public class RewardPersistenceTxService {

    private final LiveRewardRecordMapper rewardRecordMapper;
    private final LiveViewerMapper viewerMapper;
    private final RewardProperties properties;

    public RewardPersistenceTxService(LiveRewardRecordMapper rewardRecordMapper,
                                      LiveViewerMapper viewerMapper,
                                      RewardProperties properties) {
        this.rewardRecordMapper = rewardRecordMapper;
        this.viewerMapper = viewerMapper;
        this.properties = properties;
    }

    @Transactional
    public void replace(Collection<String> livingIds, List<LiveRewardRecord> records, List<LiveViewer> viewerUpdates) {
        int deleted = rewardRecordMapper.deleteByLivingIds(livingIds);
        int chunkSize = Math.max(1, properties.getInsertChunkSize());
        for (List<LiveRewardRecord> chunk : Lists.partition(records, chunkSize)) {
            rewardRecordMapper.insertBatch(chunk);
        }
        for (List<LiveViewer> chunk : Lists.partition(viewerUpdates, chunkSize)) {
            viewerMapper.updateRewardBatch(chunk);
        }
        log.info("Reward records replaced (livingIds={}, deleted={}, inserted={}, viewersUpdated={})",
                livingIds, deleted, records.size(), viewerUpdates.size());
    }
}
