package com.slb.live_backend.modules.viewer.service;

import com.google.common.collect.Lists;
import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.SignAggregateRow;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.mapper.LiveSignRecordMapper;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import com.slb.live_backend.modules.viewer.vo.SignRefreshResultVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按签到明细重算观众的签到汇总字段（是否签到、签到次数、最后签到时间）。
 */
@Service
@Slf4j
public class SignInfoService {

    private final LiveViewerMapper viewerMapper;
    private final LiveSignRecordMapper signRecordMapper;
    private final ViewerIngestProperties properties;

    public SignInfoService(LiveViewerMapper viewerMapper,
                           LiveSignRecordMapper signRecordMapper,
                           ViewerIngestProperties properties) {
        this.viewerMapper = viewerMapper;
        this.signRecordMapper = signRecordMapper;
        this.properties = properties;
    }

    @Transactional
    public SignRefreshResultVo refreshSignInfo(String livingId) {
        if (!StringUtils.hasText(livingId)) {
            throw new BizException("livingId 不能为空");
        }
        List<LiveViewer> viewers = viewerMapper.selectByLivingId(livingId);
        if (viewers.isEmpty()) {
            log.info("Sign refresh skipped, no viewers (livingId={})", livingId);
            return new SignRefreshResultVo(livingId, 0, 0, 0);
        }
        Map<Long, SignAggregateRow> byViewer = new HashMap<>();
        for (SignAggregateRow row : signRecordMapper.aggregateValidByLivingIds(List.of(livingId))) {
            byViewer.put(row.getViewerId(), row);
        }

        List<LiveViewer> changes = new ArrayList<>(viewers.size());
        int signed = 0;
        int reset = 0;
        int errors = 0;
        for (LiveViewer viewer : viewers) {
            if (viewer.getId() == null) {
                errors++;
                log.warn("Sign refresh skipped viewer without id (livingId={}, participantId={})",
                        livingId, viewer.getParticipantId());
                continue;
            }
            SignAggregateRow row = byViewer.get(viewer.getId());
            LiveViewer change = new LiveViewer();
            change.setId(viewer.getId());
            if (row != null && row.getSignCount() != null && row.getSignCount() > 0) {
                change.setSignedIn(true);
                change.setSignCount(row.getSignCount());
                change.setLastSignTime(row.getLastSignTime());
                signed++;
            } else {
                change.setSignedIn(false);
                change.setSignCount(0);
                change.setLastSignTime(null);
                reset++;
            }
            changes.add(change);
        }
        for (List<LiveViewer> chunk : Lists.partition(changes, Math.max(1, properties.getBatchSize()))) {
            viewerMapper.updateSignInfoBatch(chunk);
        }
        log.info("Sign refresh finished (livingId={}, signed={}, reset={}, errors={})", livingId, signed, reset, errors);
        return new SignRefreshResultVo(livingId, signed, reset, errors);
    }
}
