package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import com.slb.live_backend.modules.viewer.vo.ViewerStatisticsVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单场观众统计：人数、观看、签到、奖励的汇总由 SQL 聚合，
 * 邀请统计与邀请链在内存中按本场观众计算。
 */
@Service
@Slf4j
public class ViewerStatsService {

    private final LiveViewerMapper viewerMapper;

    public ViewerStatsService(LiveViewerMapper viewerMapper) {
        this.viewerMapper = viewerMapper;
    }

    public ViewerStatisticsVo getStatistics(String livingId) {
        if (!StringUtils.hasText(livingId)) {
            throw new BizException("livingId 不能为空");
        }
        ViewerStatisticsVo vo = viewerMapper.selectStatistics(livingId);
        if (vo == null) {
            vo = new ViewerStatisticsVo();
        }
        vo.setLivingId(livingId);
        long total = nz(vo.getTotalViewers());
        long signed = nz(vo.getSignedCount());
        vo.setTotalViewers(total);
        vo.setInternalViewers(nz(vo.getInternalViewers()));
        vo.setExternalViewers(nz(vo.getExternalViewers()));
        vo.setCommentedCount(nz(vo.getCommentedCount()));
        vo.setMicCount(nz(vo.getMicCount()));
        vo.setSignedCount(signed);
        vo.setTotalSignCount(nz(vo.getTotalSignCount()));
        vo.setRewardEligibleCount(nz(vo.getRewardEligibleCount()));
        if (vo.getTotalRewardAmount() == null) {
            vo.setTotalRewardAmount(BigDecimal.ZERO);
        }
        vo.setAvgWatchSeconds(vo.getAvgWatchSeconds() == null
                ? BigDecimal.ZERO
                : vo.getAvgWatchSeconds().setScale(2, RoundingMode.HALF_UP));
        // 签到率按观众人数计算，平均签到次数只算已签到的观众
        vo.setSignRate(total == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(signed * 100).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP));
        vo.setAvgSignCount(signed == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(vo.getTotalSignCount()).divide(BigDecimal.valueOf(signed), 2, RoundingMode.HALF_UP));

        fillInvitationStats(vo, viewerMapper.selectByLivingId(livingId));
        log.debug("Viewer statistics computed (livingId={}, total={}, invited={}, invitationDepth={})",
                livingId, total, vo.getInvitedCount(), vo.getInvitationDepth());
        return vo;
    }

    /**
     * 邀请链：观众的邀请人若也是本场被邀请的观众，层数为邀请人层数 + 1，否则为 1。
     * 邀请关系成环时在重复处截断。
     */
    void fillInvitationStats(ViewerStatisticsVo vo, List<LiveViewer> viewers) {
        Map<ViewerKey, LiveViewer> byKey = new HashMap<>();
        Map<String, LiveViewer> byId = new HashMap<>();
        for (LiveViewer viewer : viewers) {
            byKey.put(ViewerKey.of(viewer.getParticipantKind(), viewer.getParticipantId()), viewer);
            byId.putIfAbsent(viewer.getParticipantId(), viewer);
        }

        long invited = 0L;
        long internalInvited = 0L;
        long externalInvited = 0L;
        long direct = 0L;
        long indirect = 0L;
        int maxDepth = 0;
        Map<ViewerKey, Integer> depths = new HashMap<>();
        for (LiveViewer viewer : viewers) {
            if (!StringUtils.hasText(viewer.getInviterId())) {
                continue;
            }
            invited++;
            if (viewer.getInviterKind() == ParticipantKind.INTERNAL) {
                internalInvited++;
            } else if (viewer.getInviterKind() == ParticipantKind.EXTERNAL) {
                externalInvited++;
            }
            int depth = depthOf(viewer, byKey, byId, depths, new HashSet<>());
            if (depth > 1) {
                indirect++;
            } else {
                direct++;
            }
            maxDepth = Math.max(maxDepth, depth);
        }
        vo.setInvitedCount(invited);
        vo.setInternalInvitedCount(internalInvited);
        vo.setExternalInvitedCount(externalInvited);
        vo.setDirectInvites(direct);
        vo.setIndirectInvites(indirect);
        vo.setInvitationDepth(maxDepth);
    }

    private int depthOf(LiveViewer viewer,
                        Map<ViewerKey, LiveViewer> byKey,
                        Map<String, LiveViewer> byId,
                        Map<ViewerKey, Integer> depths,
                        Set<ViewerKey> onPath) {
        ViewerKey key = ViewerKey.of(viewer.getParticipantKind(), viewer.getParticipantId());
        Integer known = depths.get(key);
        if (known != null) {
            return known;
        }
        if (!onPath.add(key)) {
            return 0;
        }
        LiveViewer inviter = findInviter(viewer, byKey, byId);
        int depth = inviter != null && StringUtils.hasText(inviter.getInviterId())
                ? depthOf(inviter, byKey, byId, depths, onPath) + 1
                : 1;
        onPath.remove(key);
        depths.put(key, depth);
        return depth;
    }

    private LiveViewer findInviter(LiveViewer viewer, Map<ViewerKey, LiveViewer> byKey, Map<String, LiveViewer> byId) {
        if (viewer.getInviterKind() != null) {
            LiveViewer exact = byKey.get(ViewerKey.of(viewer.getInviterKind(), viewer.getInviterId()));
            if (exact != null) {
                return exact;
            }
        }
        return byId.get(viewer.getInviterId());
    }

    private static long nz(Long value) {
        return value == null ? 0L : value;
    }
}
