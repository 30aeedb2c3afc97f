package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.config.ViewerIngestProperties;
import com.slb.live_backend.modules.viewer.domain.CollectionStats;
import com.slb.live_backend.modules.viewer.domain.IdentityCache;
import com.slb.live_backend.modules.viewer.domain.IngestionRun;
import com.slb.live_backend.modules.viewer.domain.ParticipantMessage;
import com.slb.live_backend.modules.viewer.enums.IdentitySource;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import com.slb.live_backend.modules.wecom.domain.WatchStatPage;
import com.slb.live_backend.modules.wecom.domain.WeComApiException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.slb.live_backend.modules.viewer.service.ViewerTestData.external;
import static com.slb.live_backend.modules.viewer.service.ViewerTestData.internal;
import static com.slb.live_backend.modules.viewer.service.ViewerTestData.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WatchStatCollectorTest {

    private final LivePlatformClient client = mock(LivePlatformClient.class);
    private final ViewerIngestProperties properties = ViewerTestData.properties();
    private final WatchStatCollector collector = new WatchStatCollector(client, properties);

    @Test
    void shouldFollowCursorUntilEndingAndPreserveOrder() {
        when(client.fetchWatchStat("L1", "")).thenReturn(page(
                List.of(internal("u1", 10), internal("u2", 20)), List.of(external("e1", "张三", 30)), "k2", false));
        when(client.fetchWatchStat("L1", "k2")).thenReturn(page(
                List.of(internal("u3", 30)), List.of(), "", true));
        IngestionRun run = ViewerTestData.run("L1");

        CollectionStats stats = collector.collect(run);

        assertThat(stats.pages()).isEqualTo(2);
        assertThat(stats.internalPublished()).isEqualTo(3);
        assertThat(stats.externalPublished()).isEqualTo(1);
        assertThat(stats.fatal()).isFalse();
        assertThat(stats.partial()).isFalse();
        assertThat(ids(run, ParticipantKind.INTERNAL)).containsExactly("u1", "u2", "u3", "END");
        assertThat(ids(run, ParticipantKind.EXTERNAL)).containsExactly("e1", "END");
    }

    @Test
    void shouldRegisterPageNamesBeforePublishing() {
        when(client.fetchWatchStat("L1", "")).thenReturn(page(
                List.of(), List.of(external("e1", "张三", 30)), null, true));
        IngestionRun run = ViewerTestData.run("L1");

        collector.collect(run);

        IdentityCache.Resolution resolution = run.getIdentityCache().resolve("e1", ParticipantKind.EXTERNAL);
        assertThat(resolution.name()).isEqualTo("张三");
        assertThat(resolution.source()).isEqualTo(IdentitySource.API_PAGE);
    }

    @Test
    void firstPageErrorIsFatal() {
        when(client.fetchWatchStat("L1", "")).thenReturn(WatchStatPage.failed(40014, "invalid access_token"));
        IngestionRun run = ViewerTestData.run("L1");

        CollectionStats stats = collector.collect(run);

        assertThat(stats.fatal()).isTrue();
        assertThat(stats.published()).isZero();
        assertThat(stats.error()).contains("invalid access_token");
        assertThat(ids(run, ParticipantKind.INTERNAL)).containsExactly("END");
        assertThat(ids(run, ParticipantKind.EXTERNAL)).containsExactly("END");
    }

    @Test
    void firstPageExceptionIsFatal() {
        when(client.fetchWatchStat(anyString(), anyString())).thenThrow(new WeComApiException("WeCom corpId/corpSecret not configured"));
        IngestionRun run = ViewerTestData.run("L1");

        CollectionStats stats = collector.collect(run);

        assertThat(stats.fatal()).isTrue();
        assertThat(stats.error()).contains("not configured");
    }

    @Test
    void laterPageErrorKeepsEarlierPages() {
        when(client.fetchWatchStat("L1", "")).thenReturn(page(
                List.of(internal("u1", 120)), List.of(external("e1", null, 5)), "k2", false));
        when(client.fetchWatchStat("L1", "k2")).thenReturn(WatchStatPage.failed(null, "status=502"));
        IngestionRun run = ViewerTestData.run("L1");

        CollectionStats stats = collector.collect(run);

        assertThat(stats.fatal()).isFalse();
        assertThat(stats.partial()).isTrue();
        assertThat(stats.pages()).isEqualTo(2);
        assertThat(stats.error()).startsWith("page 2 failed");
        assertThat(ids(run, ParticipantKind.INTERNAL)).containsExactly("u1", "END");
        assertThat(ids(run, ParticipantKind.EXTERNAL)).containsExactly("e1", "END");
        verify(client, times(2)).fetchWatchStat(anyString(), anyString());
    }

    @Test
    void missingCursorWithoutEndingStopsPagingAsPartial() {
        when(client.fetchWatchStat("L1", "")).thenReturn(page(List.of(internal("u1", 1)), List.of(), "", false));
        IngestionRun run = ViewerTestData.run("L1");

        CollectionStats stats = collector.collect(run);

        assertThat(stats.pages()).isEqualTo(1);
        assertThat(stats.partial()).isTrue();
        assertThat(stats.fatal()).isFalse();
        assertThat(stats.error()).isEqualTo("page 1 has no next_key but is not ending");
        assertThat(stats.internalPublished()).isEqualTo(1);
        verify(client, times(1)).fetchWatchStat(anyString(), anyString());
    }

    @Test
    void boundedQueueDeliversEveryRecordUnderBackpressure() throws Exception {
        List<WatchParticipant> many = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            many.add(internal("u" + i, i));
        }
        when(client.fetchWatchStat("L1", "")).thenReturn(page(many, List.of(), null, true));
        IngestionRun run = ViewerTestData.run("L1", new IdentityCache(null, null, null, false), 2, 5_000L);

        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<List<String>> consumed = consumer.submit(() -> {
                List<String> seen = new ArrayList<>();
                ParticipantMessage message;
                while ((message = run.next(ParticipantKind.INTERNAL)) != null && !message.isEnd()) {
                    assertThat(run.queueFor(ParticipantKind.INTERNAL).size()).isLessThanOrEqualTo(2);
                    seen.add(message.participant().participantId());
                }
                return seen;
            });

            CollectionStats stats = collector.collect(run);

            List<String> seen = consumed.get(5, TimeUnit.SECONDS);
            assertThat(stats.internalPublished()).isEqualTo(50);
            assertThat(seen).hasSize(50);
            assertThat(seen.get(0)).isEqualTo("u0");
            assertThat(seen.get(49)).isEqualTo("u49");
        } finally {
            consumer.shutdownNow();
        }
    }

    @Test
    void fullQueueWithoutConsumerStopsAtDeadline() {
        when(client.fetchWatchStat("L1", "")).thenReturn(page(
                List.of(internal("u1", 1), internal("u2", 2), internal("u3", 3)), List.of(), null, true));
        IngestionRun run = ViewerTestData.run("L1", new IdentityCache(null, null, null, false), 1, 200L);

        CollectionStats stats = collector.collect(run);

        assertThat(stats.partial()).isTrue();
        assertThat(stats.internalPublished()).isEqualTo(1);
        assertThat(stats.error()).contains("run stopped");
    }

    private static List<String> ids(IngestionRun run, ParticipantKind kind) {
        List<String> ids = new ArrayList<>();
        for (ParticipantMessage message : run.queueFor(kind)) {
            ids.add(message.isEnd() ? "END" : message.participant().participantId());
        }
        return ids;
    }
}
