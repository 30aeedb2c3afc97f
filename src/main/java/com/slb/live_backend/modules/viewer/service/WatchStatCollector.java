package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.CollectionStats;
import com.slb.live_backend.modules.viewer.domain.IdentityCache;
import com.slb.live_backend.modules.viewer.domain.IngestionRun;
import com.slb.live_backend.modules.viewer.domain.ParticipantMessage;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import com.slb.live_backend.modules.wecom.domain.WatchStatPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 分页拉取观看明细，逐条推入对应类型的有界队列。
 * <p>
 * 第一页失败视为整次同步失败；后续页失败则停止翻页，已入队数据照常对账（部分成功）。
 * 无论如何结束，两个队列都会收到结束标记。
 */
@Service
@Slf4j
public class WatchStatCollector {

    private final LivePlatformClient client;
    private final ViewerIngestProperties properties;

    public WatchStatCollector(LivePlatformClient client, ViewerIngestProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public CollectionStats collect(IngestionRun run) {
        String livingId = run.getLivingId();
        String nextKey = "";
        int page = 0;
        int internalPublished = 0;
        int externalPublished = 0;
        boolean fatal = false;
        boolean partial = false;
        String error = null;

        try {
            while (true) {
                if (run.isStopped()) {
                    partial = true;
                    error = run.isCancelled() ? "collection cancelled" : "collection timed out";
                    log.warn("Watch stat collection stopped early (livingId={}, page={}, reason={})", livingId, page, error);
                    break;
                }
                if (page >= properties.getMaxPages()) {
                    partial = true;
                    error = "page limit reached: " + properties.getMaxPages();
                    log.warn("Watch stat collection hit page limit (livingId={}, maxPages={})", livingId, properties.getMaxPages());
                    break;
                }
                page++;

                WatchStatPage result = fetchPage(livingId, nextKey, page);
                if (!result.isSuccess()) {
                    error = "page " + page + " failed: " + result.error();
                    if (page == 1) {
                        fatal = true;
                        log.error("Watch stat first page failed, aborting (livingId={}, errcode={}, error={})",
                                livingId, result.errcode(), result.error());
                    } else {
                        partial = true;
                        log.warn("Watch stat page failed, keeping earlier pages (livingId={}, page={}, errcode={}, error={})",
                                livingId, page, result.errcode(), result.error());
                    }
                    break;
                }

                registerPageHints(run.getIdentityCache(), result);
                int pushedInternal = publishAll(run, ParticipantKind.INTERNAL, result.internalUsers(), page);
                internalPublished += pushedInternal;
                if (pushedInternal < result.internalUsers().size()) {
                    partial = true;
                    error = "run stopped while publishing page " + page;
                    break;
                }
                int pushedExternal = publishAll(run, ParticipantKind.EXTERNAL, result.externalUsers(), page);
                externalPublished += pushedExternal;
                if (pushedExternal < result.externalUsers().size()) {
                    partial = true;
                    error = "run stopped while publishing page " + page;
                    break;
                }
                log.debug("Watch stat page published (livingId={}, page={}, internal={}, external={}, ending={})",
                        livingId, page, pushedInternal, pushedExternal, result.ending());

                if (result.ending()) {
                    break;
                }
                if (!StringUtils.hasText(result.nextKey())) {
                    // 未声明结束却没有游标，继续请求只会重复第一页；已拉取的数据不完整
                    partial = true;
                    error = "page " + page + " has no next_key but is not ending";
                    log.warn("Watch stat page has no next_key but is not ending, stopping (livingId={}, page={})", livingId, page);
                    break;
                }
                nextKey = result.nextKey();

                if (properties.getPagesPerPause() > 0 && page % properties.getPagesPerPause() == 0) {
                    Thread.sleep(properties.getPagePauseMs());
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            partial = true;
            error = "collection interrupted";
            log.warn("Watch stat collection interrupted (livingId={}, page={})", livingId, page);
        } finally {
            run.publishEnd(ParticipantKind.INTERNAL);
            run.publishEnd(ParticipantKind.EXTERNAL);
        }

        log.info("Watch stat collection finished (livingId={}, pages={}, internal={}, external={}, fatal={}, partial={})",
                livingId, page, internalPublished, externalPublished, fatal, partial);
        return new CollectionStats(page, internalPublished, externalPublished, fatal, partial, error);
    }

    private WatchStatPage fetchPage(String livingId, String nextKey, int page) {
        try {
            return client.fetchWatchStat(livingId, nextKey);
        } catch (RuntimeException ex) {
            log.warn("Watch stat request threw (livingId={}, page={}, message={})", livingId, page, ex.getMessage());
            return WatchStatPage.failed(null, ex.getMessage());
        }
    }

    /**
     * 页内出现的昵称先登记到身份缓存，再发布该页记录，保证对账时能命中。
     */
    private void registerPageHints(IdentityCache cache, WatchStatPage page) {
        for (WatchParticipant participant : page.internalUsers()) {
            cache.registerPageHint(participant.participantId(), participant.name());
        }
        for (WatchParticipant participant : page.externalUsers()) {
            cache.registerPageHint(participant.participantId(), participant.name());
        }
    }

    private int publishAll(IngestionRun run, ParticipantKind kind, List<WatchParticipant> participants, int page)
            throws InterruptedException {
        int pushed = 0;
        for (WatchParticipant participant : participants) {
            if (!run.publish(kind, new ParticipantMessage(participant, page))) {
                return pushed;
            }
            pushed++;
        }
        return pushed;
    }
}
