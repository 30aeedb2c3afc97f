package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.IdentityCache;
import com.slb.live_backend.modules.viewer.domain.IngestionRun;
import com.slb.live_backend.modules.viewer.domain.ParticipantMessage;
import com.slb.live_backend.modules.viewer.domain.PendingInvitation;
import com.slb.live_backend.modules.viewer.domain.ReconcileResult;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 消费单一类型的观众队列，与已有记录比对后分别进入新增 / 更新批次，满批即写入并提交。
 * <p>
 * 合并规则：观看时长、评论、连麦、进出时间以最新为准；昵称、邀请人仅在有值时覆盖；
 * 签到与奖励字段不动。
 */
@Service
@Slf4j
public class ViewerBatchReconciler {

    public static final String REWARD_STATUS_NONE = "NONE";

    private final ViewerBatchWriterFactory writerFactory;
    private final ViewerIngestProperties properties;

    public ViewerBatchReconciler(ViewerBatchWriterFactory writerFactory, ViewerIngestProperties properties) {
        this.writerFactory = writerFactory;
        this.properties = properties;
    }

    public ReconcileResult reconcile(IngestionRun run, ParticipantKind kind) {
        Batch batch = new Batch(run, kind, Math.max(1, properties.getBatchSize()));
        String failure = null;

        try (ViewerBatchWriter writer = writerFactory.open()) {
            try {
                while (true) {
                    ParticipantMessage message = run.next(kind);
                    if (message == null) {
                        failure = run.isCancelled() ? "reconcile cancelled" : "reconcile timed out";
                        log.warn("Viewer reconcile stopped before end marker (livingId={}, kind={}, processed={})",
                                run.getLivingId(), kind, batch.processed);
                        break;
                    }
                    if (message.isEnd()) {
                        break;
                    }
                    batch.accept(message);
                    if (batch.isCreateFull()) {
                        batch.flushCreates(writer);
                    }
                    if (batch.isUpdateFull()) {
                        batch.flushUpdates(writer);
                    }
                }
                batch.flushCreates(writer);
                batch.flushUpdates(writer);
            } catch (RuntimeException ex) {
                failure = "flush failed: " + ex.getMessage();
                log.error("Viewer batch flush failed, aborting reconciler (livingId={}, kind={}, processed={})",
                        run.getLivingId(), kind, batch.processed, ex);
                rollbackQuietly(writer, run, kind);
                int dropped = run.drain(kind);
                log.warn("Drained remaining viewer messages after failure (livingId={}, kind={}, dropped={})",
                        run.getLivingId(), kind, dropped);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            failure = "reconcile interrupted";
            log.warn("Viewer reconcile interrupted (livingId={}, kind={})", run.getLivingId(), kind);
        }

        log.info("Viewer reconcile finished (livingId={}, kind={}, processed={}, created={}, updated={}, errors={}, unresolved={})",
                run.getLivingId(), kind, batch.processed, batch.created, batch.updated, batch.errors, batch.unresolved.size());
        return new ReconcileResult(kind, batch.processed, batch.created, batch.updated, batch.errors,
                batch.unresolved, failure);
    }

    private void rollbackQuietly(ViewerBatchWriter writer, IngestionRun run, ParticipantKind kind) {
        try {
            writer.rollback();
        } catch (RuntimeException rollbackEx) {
            log.warn("Viewer batch rollback failed (livingId={}, kind={}, message={})",
                    run.getLivingId(), kind, rollbackEx.getMessage());
        }
    }

    /**
     * 单个对账线程的批次状态，不跨线程共享。
     */
    private static final class Batch {

        private final IngestionRun run;
        private final ParticipantKind kind;
        private final int batchSize;
        private final List<LiveViewer> creates = new ArrayList<>();
        private final Set<ViewerKey> pendingCreateKeys = new HashSet<>();
        private final Map<ViewerKey, LiveViewer> updates = new LinkedHashMap<>();
        private final Map<ViewerKey, PendingInvitation> unresolved = new HashMap<>();

        private int processed;
        private int created;
        private int updated;
        private int errors;

        private Batch(IngestionRun run, ParticipantKind kind, int batchSize) {
            this.run = run;
            this.kind = kind;
            this.batchSize = batchSize;
        }

        private void accept(ParticipantMessage message) {
            processed++;
            WatchParticipant participant = message.participant();
            try {
                participant.validate();
                apply(participant);
            } catch (RuntimeException ex) {
                errors++;
                log.warn("Skipping viewer record (livingId={}, kind={}, page={}, message={})",
                        run.getLivingId(), kind, message.page(), ex.getMessage());
            }
        }

        private void apply(WatchParticipant participant) {
            ViewerKey key = ViewerKey.of(participant.kind(), participant.participantId());
            IdentityCache cache = run.getIdentityCache();
            LocalDateTime now = LocalDateTime.now();

            LiveViewer existing = run.getExistingIndex().get(key);
            if (existing == null) {
                LiveViewer viewer = new LiveViewer();
                viewer.setLivingId(run.getLivingId());
                viewer.setParticipantKind(participant.kind());
                viewer.setParticipantId(participant.participantId());
                viewer.setSignedIn(false);
                viewer.setSignCount(0);
                viewer.setInvitedByHost(false);
                viewer.setRewardEligible(false);
                viewer.setRewardAmount(BigDecimal.ZERO);
                viewer.setRewardStatus(REWARD_STATUS_NONE);
                viewer.setCreatedTime(now);
                merge(viewer, participant, key, cache, now);
                if (!StringUtils.hasText(viewer.getName())) {
                    viewer.setName(cache.resolveLocal(participant.participantId()).name());
                }
                run.getExistingIndex().put(key, viewer);
                creates.add(viewer);
                pendingCreateKeys.add(key);
                created++;
                return;
            }

            merge(existing, participant, key, cache, now);
            // 本次新建且未写入的记录已在原地合并，不算更新
            if (!pendingCreateKeys.contains(key) && updates.put(key, existing) == null) {
                updated++;
            }
        }

        private void merge(LiveViewer viewer, WatchParticipant participant, ViewerKey key,
                           IdentityCache cache, LocalDateTime now) {
            viewer.setWatchSeconds(participant.watchSeconds());
            viewer.setCommented(participant.commented());
            viewer.setUsedMic(participant.usedMic());
            viewer.setFirstEnterTime(participant.firstEnterTime());
            viewer.setLastEnterTime(participant.lastEnterTime());
            viewer.setUpdatedTime(now);
            if (StringUtils.hasText(participant.name())) {
                viewer.setName(participant.name());
            }
            if (!participant.hasInviter()) {
                return;
            }
            IdentityCache.Resolution inviter = cache.resolve(participant.inviterId(), participant.inviterKind());
            viewer.setInviterId(participant.inviterId());
            viewer.setInviterKind(participant.inviterKind());
            viewer.setInviterName(inviter.name());
            viewer.setInvitedByHost(run.isHost(participant.inviterId()));
            if (inviter.found()) {
                unresolved.remove(key);
            } else {
                unresolved.put(key, new PendingInvitation(participant.inviterId(), participant.inviterKind()));
            }
        }

        private boolean isCreateFull() {
            return creates.size() >= batchSize;
        }

        private boolean isUpdateFull() {
            return updates.size() >= batchSize;
        }

        private void flushCreates(ViewerBatchWriter writer) {
            if (creates.isEmpty()) {
                return;
            }
            writer.insert(new ArrayList<>(creates));
            writer.commit();
            log.debug("Viewer creates flushed (livingId={}, kind={}, size={})", run.getLivingId(), kind, creates.size());
            creates.clear();
            pendingCreateKeys.clear();
        }

        private void flushUpdates(ViewerBatchWriter writer) {
            if (updates.isEmpty()) {
                return;
            }
            writer.update(new ArrayList<>(updates.values()));
            writer.commit();
            log.debug("Viewer updates flushed (livingId={}, kind={}, size={})", run.getLivingId(), kind, updates.size());
            updates.clear();
        }
    }
}
