package com.slb.live_backend.modules.viewer.service;

import com.google.common.collect.Lists;
import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.IdNameRow;
import com.slb.live_backend.modules.viewer.domain.IngestionRun;
import com.slb.live_backend.modules.viewer.domain.InviterUpdate;
import com.slb.live_backend.modules.viewer.domain.PendingInvitation;
import com.slb.live_backend.modules.viewer.domain.ViewerIdRow;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.InvitorCache;
import com.slb.live_backend.modules.viewer.mapper.InvitorCacheMapper;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 同步结束后回填对账阶段未解析的邀请人名称。
 * 名称查找：主播 → invitor_cache → 历史观众昵称（批量）→ 逐个兜底查询；仍查不到的保留 id。
 */
@Service
@Slf4j
public class InvitationBackfillService {

    private final LiveViewerMapper viewerMapper;
    private final InvitorCacheMapper invitorCacheMapper;
    private final ViewerIngestProperties properties;

    public InvitationBackfillService(LiveViewerMapper viewerMapper,
                                     InvitorCacheMapper invitorCacheMapper,
                                     ViewerIngestProperties properties) {
        this.viewerMapper = viewerMapper;
        this.invitorCacheMapper = invitorCacheMapper;
        this.properties = properties;
    }

    /**
     * @return 实际写回的观众行数
     */
    public int backfill(IngestionRun run, Map<ViewerKey, PendingInvitation> unresolved) {
        if (unresolved == null || unresolved.isEmpty()) {
            return 0;
        }
        String livingId = run.getLivingId();
        Set<String> inviterIds = unresolved.values().stream()
                .map(PendingInvitation::inviterId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, String> names = resolveNames(run, inviterIds);
        if (names.isEmpty()) {
            log.info("Invitation backfill resolved no inviter names (livingId={}, unresolved={})", livingId, unresolved.size());
            return 0;
        }

        Map<ViewerKey, Long> viewerIds = new HashMap<>();
        for (ViewerIdRow row : viewerMapper.selectIdsByKeys(livingId, unresolved.keySet())) {
            viewerIds.put(ViewerKey.of(row.getParticipantKind(), row.getParticipantId()), row.getId());
        }

        List<InviterUpdate> updates = new ArrayList<>();
        unresolved.forEach((key, pending) -> {
            String name = names.get(pending.inviterId());
            Long viewerId = viewerIds.get(key);
            if (name == null) {
                return;
            }
            if (viewerId == null) {
                log.warn("Invitation backfill found no viewer row (livingId={}, kind={}, participantId={})",
                        livingId, key.kind(), key.participantId());
                return;
            }
            updates.add(new InviterUpdate(viewerId, name, run.isHost(pending.inviterId())));
        });

        int chunkSize = Math.max(1, Math.min(1000, properties.getBackfillChunkSize()));
        int written = 0;
        for (List<InviterUpdate> chunk : Lists.partition(updates, chunkSize)) {
            viewerMapper.updateInviterBatch(chunk);
            written += chunk.size();
        }
        log.info("Invitation backfill finished (livingId={}, unresolved={}, inviters={}, resolvedInviters={}, updated={})",
                livingId, unresolved.size(), inviterIds.size(), names.size(), written);
        return written;
    }

    private Map<String, String> resolveNames(IngestionRun run, Set<String> inviterIds) {
        Map<String, String> names = new HashMap<>();
        Set<String> remaining = new LinkedHashSet<>();
        for (String id : inviterIds) {
            if (run.isHost(id)) {
                names.put(id, run.getIdentityCache().getHostName());
            } else {
                remaining.add(id);
            }
        }
        if (!remaining.isEmpty()) {
            for (InvitorCache cached : invitorCacheMapper.selectByIds(remaining)) {
                if (StringUtils.hasText(cached.getName())) {
                    names.putIfAbsent(cached.getInvitorId(), cached.getName());
                }
            }
            remaining.removeAll(names.keySet());
        }
        if (!remaining.isEmpty()) {
            for (IdNameRow row : viewerMapper.selectNamesByParticipantIds(remaining)) {
                if (StringUtils.hasText(row.getName())) {
                    names.putIfAbsent(row.getId(), row.getName());
                }
            }
            remaining.removeAll(names.keySet());
        }
        for (String id : remaining) {
            String name = viewerMapper.selectLatestNameByParticipantId(id);
            if (StringUtils.hasText(name)) {
                names.put(id, name);
            } else {
                log.debug("Inviter name still unresolved, keeping raw id (livingId={}, inviterId={})", run.getLivingId(), id);
            }
        }
        return names;
    }
}
