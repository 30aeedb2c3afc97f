package com.slb.live_backend.modules.viewer.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.common.trace.TraceIdHolder;
import com.slb.live_backend.modules.living.entity.Living;
import com.slb.live_backend.modules.living.service.LivingService;
import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.CollectionStats;
import com.slb.live_backend.modules.viewer.domain.IdentityCache;
import com.slb.live_backend.modules.viewer.domain.IngestionRun;
import com.slb.live_backend.modules.viewer.domain.KindCount;
import com.slb.live_backend.modules.viewer.domain.PendingInvitation;
import com.slb.live_backend.modules.viewer.domain.ReconcileResult;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.InvitorCache;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.viewer.mapper.InvitorCacheMapper;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import com.slb.live_backend.modules.viewer.vo.IngestionResult;
import com.slb.live_backend.modules.viewer.vo.ViewerSyncStatsVo;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 单场直播观众同步的编排：
 * 1) 预加载已有观众与邀请人缓存；
 * 2) 三线程并行：分页拉取 + 企业成员对账 + 外部用户对账；
 * 3) 回填未解析的邀请人名称，持久化远程查询结果；
 * 4) 汇总统计并记录同步状态。
 * <p>
 * 对外不抛异常（入参校验与同场并发同步除外，后者为 409），结果通过 {@link IngestionResult} 返回。
 */
@Service
@Slf4j
public class ViewerIngestionService {

    private static final int WORKERS = 3;

    private final LivingService livingService;
    private final LiveViewerMapper viewerMapper;
    private final InvitorCacheMapper invitorCacheMapper;
    private final LivePlatformClient platformClient;
    private final WatchStatCollector collector;
    private final ViewerBatchReconciler reconciler;
    private final InvitationBackfillService backfillService;
    private final ViewerSyncStatus syncStatus;
    private final ViewerIngestProperties properties;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ViewerIngestionService(LivingService livingService,
                                  LiveViewerMapper viewerMapper,
                                  InvitorCacheMapper invitorCacheMapper,
                                  LivePlatformClient platformClient,
                                  WatchStatCollector collector,
                                  ViewerBatchReconciler reconciler,
                                  InvitationBackfillService backfillService,
                                  ViewerSyncStatus syncStatus,
                                  ViewerIngestProperties properties) {
        this.livingService = livingService;
        this.viewerMapper = viewerMapper;
        this.invitorCacheMapper = invitorCacheMapper;
        this.platformClient = platformClient;
        this.collector = collector;
        this.reconciler = reconciler;
        this.backfillService = backfillService;
        this.syncStatus = syncStatus;
        this.properties = properties;
    }

    public IngestionResult processViewerInfo(String livingId) {
        if (!StringUtils.hasText(livingId)) {
            throw new BizException("livingId 不能为空");
        }
        // 同一场次同一时刻只允许一次同步
        if (!inFlight.add(livingId)) {
            log.warn("Viewer sync rejected, another sync of this living is running (livingId={})", livingId);
            throw new BizException(409, "该场直播正在同步中，请稍后再试: " + livingId);
        }
        try {
            return runSync(livingId);
        } finally {
            inFlight.remove(livingId);
        }
    }

    private IngestionResult runSync(String livingId) {
        long startedAt = System.currentTimeMillis();
        String traceId = TraceIdHolder.require();
        ViewerSyncStatsVo stats = new ViewerSyncStatsVo();
        stats.setLivingId(livingId);
        stats.setTraceId(traceId);
        log.info("Viewer sync started (livingId={})", livingId);

        IngestionResult result;
        try {
            IngestionRun run = prepareRun(livingId, traceId);
            result = execute(run, stats);
        } catch (RuntimeException ex) {
            log.error("Viewer sync failed unexpectedly (livingId={})", livingId, ex);
            markError(stats, ex.getMessage());
            result = IngestionResult.failed("同步失败: " + ex.getMessage(), stats);
        }

        stats.setLastSyncTime(LocalDateTime.now());
        stats.setDurationMs(System.currentTimeMillis() - startedAt);
        String status = !result.success() ? "FAILED" : (result.partial() ? "PARTIAL" : "SUCCESS");
        syncStatus.recordSync(status, result.message(), stats);
        log.info("Viewer sync finished (livingId={}, status={}, processed={}, errors={}, durationMs={})",
                livingId, status, stats.getProcessed(), stats.getErrorCount(), stats.getDurationMs());
        return result;
    }

    private IngestionRun prepareRun(String livingId, String traceId) {
        Living living = livingService.findByLivingId(livingId).orElse(null);
        if (living == null) {
            log.warn("Living not found locally, syncing without host info (livingId={})", livingId);
        }
        List<LiveViewer> existing = viewerMapper.selectByLivingId(livingId);

        String hostId = living != null ? living.getAnchorUserId() : null;
        String hostName = living != null ? living.getAnchorName() : null;
        if (!StringUtils.hasText(hostName) && StringUtils.hasText(hostId)) {
            hostName = existing.stream()
                    .filter(v -> hostId.equals(v.getParticipantId()) && StringUtils.hasText(v.getName()))
                    .map(LiveViewer::getName)
                    .findFirst()
                    .orElse(null);
        }
        IdentityCache cache = new IdentityCache(hostId, hostName, platformClient, properties.isRemoteLookupEnabled());

        IngestionRun run = new IngestionRun(livingId, living, traceId, cache,
                properties.getQueueCapacity(), properties.getQueuePollMs(), properties.getRunTimeoutMs());
        for (LiveViewer viewer : existing) {
            run.indexExisting(viewer);
            if (StringUtils.hasText(viewer.getName()) && !viewer.getName().equals(viewer.getParticipantId())) {
                cache.preload(viewer.getParticipantId(), viewer.getName());
            }
        }
        List<InvitorCache> cached = invitorCacheMapper.selectAll();
        for (InvitorCache entry : cached) {
            cache.preload(entry.getInvitorId(), entry.getName());
        }
        log.info("Viewer sync prepared (livingId={}, existingViewers={}, cachedInviters={}, hostId={})",
                livingId, existing.size(), cached.size(), hostId);
        return run;
    }

    private IngestionResult execute(IngestionRun run, ViewerSyncStatsVo stats) {
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS, new ThreadFactoryBuilder()
                .setNameFormat("viewer-sync-" + run.getLivingId() + "-%d")
                .setDaemon(true)
                .build());
        CollectionStats collection;
        List<ReconcileResult> reconciled = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        try {
            Future<CollectionStats> collectFuture = pool.submit(withTrace(run, () -> collector.collect(run)));
            Future<ReconcileResult> internalFuture =
                    pool.submit(withTrace(run, () -> reconciler.reconcile(run, ParticipantKind.INTERNAL)));
            Future<ReconcileResult> externalFuture =
                    pool.submit(withTrace(run, () -> reconciler.reconcile(run, ParticipantKind.EXTERNAL)));

            collection = await(run, collectFuture, "collector", failures);
            for (Future<ReconcileResult> future : List.of(internalFuture, externalFuture)) {
                ReconcileResult one = await(run, future, "reconciler", failures);
                if (one != null) {
                    reconciled.add(one);
                    if (one.isFailed()) {
                        failures.add(one.kind() + ": " + one.failure());
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }

        int processed = 0;
        int errors = 0;
        int created = 0;
        int updated = 0;
        Map<ViewerKey, PendingInvitation> unresolved = new HashMap<>();
        for (ReconcileResult one : reconciled) {
            processed += one.processed();
            errors += one.errors();
            created += one.created();
            updated += one.updated();
            unresolved.putAll(one.unresolvedInvitations());
        }
        stats.setPages(collection != null ? collection.pages() : 0);
        stats.setProcessed(processed);
        stats.setErrorCount(errors);
        stats.setSuccessCount(processed - errors);
        stats.setCreated(created);
        stats.setUpdated(updated);

        if (collection == null || collection.fatal()) {
            String reason = collection != null ? collection.error() : String.join("; ", failures);
            markError(stats, reason);
            return IngestionResult.failed("获取观看数据失败: " + reason, stats);
        }

        stats.setBackfilled(runBackfill(run, unresolved, failures));
        persistRemoteHits(run);
        stats.setRemoteLookups(run.getIdentityCache().getRemoteCalls());
        stats.setResolutionMisses(run.getIdentityCache().getMisses());
        fillTotals(run.getLivingId(), stats);

        if (!failures.isEmpty()) {
            String reason = String.join("; ", failures);
            markError(stats, reason);
            return IngestionResult.failed("观众数据写入失败: " + reason, stats);
        }
        if (collection.partial()) {
            markError(stats, collection.error());
            return new IngestionResult(true, true, "部分分页获取失败，已处理 " + processed + " 条: " + collection.error(), stats);
        }
        return new IngestionResult(true, false, "同步完成，处理 " + processed + " 条，失败 " + errors + " 条", stats);
    }

    private <T> T await(IngestionRun run, Future<T> future, String worker, List<String> failures) {
        try {
            return future.get(run.remainingMillis() + properties.getQueuePollMs() * 5, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            run.cancel();
            future.cancel(true);
            failures.add(worker + " timed out");
            log.error("Viewer sync worker timed out (livingId={}, worker={})", run.getLivingId(), worker);
        } catch (ExecutionException ex) {
            run.cancel();
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            failures.add(worker + " failed: " + cause.getMessage());
            log.error("Viewer sync worker failed (livingId={}, worker={})", run.getLivingId(), worker, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            run.cancel();
            failures.add(worker + " interrupted");
            log.warn("Viewer sync interrupted while waiting (livingId={}, worker={})", run.getLivingId(), worker);
        }
        return null;
    }

    private int runBackfill(IngestionRun run, Map<ViewerKey, PendingInvitation> unresolved, List<String> failures) {
        try {
            return backfillService.backfill(run, unresolved);
        } catch (RuntimeException ex) {
            failures.add("backfill failed: " + ex.getMessage());
            log.error("Invitation backfill failed (livingId={}, unresolved={})", run.getLivingId(), unresolved.size(), ex);
            return 0;
        }
    }

    /**
     * 远程查询命中的名称写入 invitor_cache，失败只记日志，不影响本次结果。
     */
    private void persistRemoteHits(IngestionRun run) {
        Map<String, String> hits = run.getIdentityCache().getRemoteHits();
        if (hits.isEmpty()) {
            return;
        }
        List<InvitorCache> records = new ArrayList<>(hits.size());
        hits.forEach((id, name) -> {
            InvitorCache record = new InvitorCache();
            record.setInvitorId(id);
            record.setName(name);
            records.add(record);
        });
        try {
            invitorCacheMapper.upsertBatch(records);
            log.info("Inviter cache updated from remote lookups (livingId={}, size={})", run.getLivingId(), records.size());
        } catch (RuntimeException ex) {
            log.warn("Inviter cache update failed (livingId={}, size={}, message={})",
                    run.getLivingId(), records.size(), ex.getMessage());
        }
    }

    private void fillTotals(String livingId, ViewerSyncStatsVo stats) {
        long internal = 0L;
        long external = 0L;
        for (KindCount row : viewerMapper.countByKind(livingId)) {
            long total = row.getTotal() != null ? row.getTotal() : 0L;
            if (row.getParticipantKind() == ParticipantKind.EXTERNAL) {
                external += total;
            } else {
                internal += total;
            }
        }
        stats.setInternalViewers(internal);
        stats.setExternalViewers(external);
        stats.setTotalViewers(internal + external);
    }

    private void markError(ViewerSyncStatsVo stats, String error) {
        stats.setLastError(error);
        stats.setLastErrorTime(LocalDateTime.now());
    }

    private <T> Callable<T> withTrace(IngestionRun run, Callable<T> task) {
        return () -> {
            TraceIdHolder.set(run.getTraceId());
            try {
                return task.call();
            } finally {
                TraceIdHolder.clear();
            }
        };
    }
}
