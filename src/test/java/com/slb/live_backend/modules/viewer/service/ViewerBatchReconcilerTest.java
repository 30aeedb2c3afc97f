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
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import com.slb.live_backend.modules.wecom.domain.WatchParticipant;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.slb.live_backend.modules.viewer.service.ViewerTestData.existing;
import static com.slb.live_backend.modules.viewer.service.ViewerTestData.internal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ViewerBatchReconcilerTest {

    private final RecordingViewerBatchWriterFactory writers = new RecordingViewerBatchWriterFactory();
    private final ViewerIngestProperties properties = ViewerTestData.properties();

    @Test
    void laterSightingOverwritesAttendanceWithoutDuplicateCreate() throws Exception {
        IngestionRun run = ViewerTestData.run("L1");
        feed(run, ParticipantKind.INTERNAL, internal("u1", 120), internal("u1", 400));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.created()).isEqualTo(1);
        assertThat(result.updated()).isZero();
        assertThat(writers.inserted()).hasSize(1);
        assertThat(writers.inserted().get(0).getWatchSeconds()).isEqualTo(400);
        assertThat(writers.updated()).isEmpty();
        assertThat(writers.closes.get()).isEqualTo(1);
    }

    @Test
    void repeatedSightingOfExistingViewerCountsOneUpdate() throws Exception {
        IngestionRun run = ViewerTestData.run("L1");
        run.indexExisting(existing(10L, "L1", ParticipantKind.INTERNAL, "u1"));
        feed(run, ParticipantKind.INTERNAL, internal("u1", 200), internal("u1", 300));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.updated()).isEqualTo(1);
        assertThat(writers.updated()).hasSize(1);
        assertThat(writers.updated().get(0).getWatchSeconds()).isEqualTo(300);
    }

    @Test
    void namelessNewViewerKeepsRawIdWithoutRemoteLookup() throws Exception {
        LivePlatformClient client = mock(LivePlatformClient.class);
        IngestionRun run = ViewerTestData.run("L1", new IdentityCache("host1", "主播", client, true), 100, 5_000L);
        feed(run, ParticipantKind.INTERNAL, internal("u1", 10), internal("u2", 20, "x9"));
        when(client.lookupUser("x9")).thenReturn(new ContactLookup("邀请人九", 0));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.created()).isEqualTo(2);
        assertThat(writers.inserted()).extracting(LiveViewer::getName).containsExactly("u1", "u2");
        LiveViewer invited = writers.inserted().get(1);
        assertThat(invited.getInviterName()).isEqualTo("邀请人九");
        assertThat(invited.getInviterKind()).isEqualTo(ParticipantKind.INTERNAL);
        verify(client, never()).lookupUser("u1");
        verify(client, never()).lookupUser("u2");
        verify(client, never()).lookupExternalContact(anyString());
        assertThat(run.getIdentityCache().getMisses()).isZero();
    }

    @Test
    void existingViewerIsUpdatedAndKeepsSignAndRewardFields() throws Exception {
        IngestionRun run = ViewerTestData.run("L1");
        run.indexExisting(existing(10L, "L1", ParticipantKind.INTERNAL, "u1"));
        feed(run, ParticipantKind.INTERNAL, internal("u1", 900), internal("u2", 60));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
        assertThat(writers.updated()).hasSize(1);
        LiveViewer updated = writers.updated().get(0);
        assertThat(updated.getId()).isEqualTo(10L);
        assertThat(updated.getWatchSeconds()).isEqualTo(900);
        assertThat(updated.getName()).isEqualTo("老观众u1");
        assertThat(updated.getSignCount()).isEqualTo(3);
        assertThat(updated.getSignedIn()).isTrue();
        assertThat(updated.getRewardAmount()).isEqualByComparingTo("5.00");

        LiveViewer created = writers.inserted().get(0);
        assertThat(created.getParticipantId()).isEqualTo("u2");
        assertThat(created.getLivingId()).isEqualTo("L1");
        assertThat(created.getSignCount()).isZero();
        assertThat(created.getRewardEligible()).isFalse();
        assertThat(created.getRewardAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(created.getRewardStatus()).isEqualTo("NONE");
        assertThat(created.getName()).isEqualTo("u2");
    }

    @Test
    void flushesWhenBatchIsFull() throws Exception {
        properties.setBatchSize(2);
        IngestionRun run = ViewerTestData.run("L1");
        feed(run, ParticipantKind.INTERNAL,
                internal("u1", 1), internal("u2", 2), internal("u3", 3), internal("u4", 4), internal("u5", 5));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.created()).isEqualTo(5);
        assertThat(writers.insertBatches.stream().map(List::size).toList()).containsExactly(2, 2, 1);
        assertThat(writers.commits.get()).isEqualTo(3);
    }

    @Test
    void sightingAfterFlushBecomesUpdate() throws Exception {
        properties.setBatchSize(1);
        IngestionRun run = ViewerTestData.run("L1");
        feed(run, ParticipantKind.INTERNAL, internal("u1", 10), internal("u1", 50));

        reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(writers.inserted()).hasSize(1);
        assertThat(writers.updated()).hasSize(1);
        assertThat(writers.updated().get(0).getWatchSeconds()).isEqualTo(50);
    }

    @Test
    void invalidRecordIsCountedAndSkipped() throws Exception {
        IngestionRun run = ViewerTestData.run("L1");
        feed(run, ParticipantKind.INTERNAL, internal(null, 10), internal("u1", -1), internal("u2", 5));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.processed()).isEqualTo(3);
        assertThat(result.errors()).isEqualTo(2);
        assertThat(result.created()).isEqualTo(1);
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    void inviterResolvesToHostOrIsLeftForBackfill() throws Exception {
        IngestionRun run = ViewerTestData.run("L1", new IdentityCache("host1", "主播小王", null, false), 100, 5_000L);
        feed(run, ParticipantKind.INTERNAL, internal("u1", 10, "host1"), internal("u2", 10, "x9"));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        LiveViewer byHost = writers.inserted().get(0);
        assertThat(byHost.getInvitedByHost()).isTrue();
        assertThat(byHost.getInviterName()).isEqualTo("主播小王");
        LiveViewer byOther = writers.inserted().get(1);
        assertThat(byOther.getInvitedByHost()).isFalse();
        assertThat(byOther.getInviterName()).isEqualTo("x9");
        assertThat(result.unresolvedInvitations())
                .containsOnlyKeys(ViewerKey.of(ParticipantKind.INTERNAL, "u2"))
                .containsEntry(ViewerKey.of(ParticipantKind.INTERNAL, "u2"), new PendingInvitation("x9", ParticipantKind.INTERNAL));
    }

    @Test
    void flushFailureRollsBackAndDrainsQueue() throws Exception {
        properties.setBatchSize(1);
        writers.failOnInsertCall(2);
        IngestionRun run = ViewerTestData.run("L1");
        feed(run, ParticipantKind.INTERNAL, internal("u1", 1), internal("u2", 2), internal("u3", 3), internal("u4", 4));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.failure()).contains("flush failed");
        assertThat(writers.insertBatches).hasSize(1);
        assertThat(writers.commits.get()).isEqualTo(1);
        assertThat(writers.rollbacks.get()).isEqualTo(1);
        assertThat(run.queueFor(ParticipantKind.INTERNAL)).isEmpty();
    }

    @Test
    void missingEndMarkerTimesOut() throws Exception {
        IngestionRun run = ViewerTestData.run("L1", new IdentityCache(null, null, null, false), 10, 150L);
        run.publish(ParticipantKind.INTERNAL, new ParticipantMessage(internal("u1", 1), 1));

        ReconcileResult result = reconciler().reconcile(run, ParticipantKind.INTERNAL);

        assertThat(result.failure()).isEqualTo("reconcile timed out");
        assertThat(writers.inserted()).hasSize(1);
    }

    private ViewerBatchReconciler reconciler() {
        return new ViewerBatchReconciler(writers, properties);
    }

    private static void feed(IngestionRun run, ParticipantKind kind, WatchParticipant... participants)
            throws InterruptedException {
        for (WatchParticipant participant : participants) {
            run.publish(kind, new ParticipantMessage(participant, 1));
        }
        run.publishEnd(kind);
    }
}
