package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.IdentitySource;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import com.slb.live_backend.modules.wecom.domain.WeComApiException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IdentityCacheTest {

    private final LivePlatformClient client = mock(LivePlatformClient.class);

    @Test
    void hostResolvesWithoutRemoteLookup() {
        IdentityCache cache = new IdentityCache("host1", "主播小王", client, true);

        IdentityCache.Resolution resolution = cache.resolve("host1", ParticipantKind.INTERNAL);

        assertThat(resolution.found()).isTrue();
        assertThat(resolution.name()).isEqualTo("主播小王");
        assertThat(resolution.source()).isEqualTo(IdentitySource.HOST);
        assertThat(cache.isHost("host1")).isTrue();
        verifyNoInteractions(client);
    }

    @Test
    void hostNameFallsBackToHostId() {
        IdentityCache cache = new IdentityCache("host1", null, client, true);

        assertThat(cache.getHostName()).isEqualTo("host1");
        assertThat(cache.isHost(null)).isFalse();
    }

    @Test
    void localStoreWinsOverPageHint() {
        IdentityCache cache = new IdentityCache("host1", "主播", client, true);
        cache.preload("u1", "本地名");
        cache.registerPageHint("u1", "页面名");
        cache.registerPageHint("u2", "页面名2");

        assertThat(cache.resolve("u1", ParticipantKind.INTERNAL).source()).isEqualTo(IdentitySource.LOCAL_STORE);
        assertThat(cache.resolve("u1", ParticipantKind.INTERNAL).name()).isEqualTo("本地名");
        IdentityCache.Resolution hinted = cache.resolve("u2", ParticipantKind.INTERNAL);
        assertThat(hinted.name()).isEqualTo("页面名2");
        assertThat(hinted.source()).isEqualTo(IdentitySource.API_PAGE);
        verifyNoInteractions(client);
    }

    @Test
    void localResolutionNeverCallsRemoteAndCountsNoMiss() {
        IdentityCache cache = new IdentityCache("host1", "主播", client, true);
        cache.registerPageHint("u2", "页面名2");

        IdentityCache.Resolution unknown = cache.resolveLocal("u1");
        IdentityCache.Resolution hinted = cache.resolveLocal("u2");

        assertThat(unknown.found()).isFalse();
        assertThat(unknown.name()).isEqualTo("u1");
        assertThat(unknown.source()).isEqualTo(IdentitySource.FALLBACK);
        assertThat(hinted.name()).isEqualTo("页面名2");
        assertThat(cache.resolveLocal("host1").source()).isEqualTo(IdentitySource.HOST);
        assertThat(cache.getMisses()).isZero();
        assertThat(cache.getRemoteCalls()).isZero();
        verifyNoInteractions(client);
    }

    @Test
    void remoteLookupTriesUserThenExternalContactAndCachesHit() {
        when(client.lookupUser("e1")).thenReturn(ContactLookup.failed(60111));
        when(client.lookupExternalContact("e1")).thenReturn(new ContactLookup("外部客户", 0));
        IdentityCache cache = new IdentityCache("host1", "主播", client, true);

        IdentityCache.Resolution first = cache.resolve("e1", ParticipantKind.EXTERNAL);
        IdentityCache.Resolution second = cache.resolve("e1", ParticipantKind.EXTERNAL);

        assertThat(first.name()).isEqualTo("外部客户");
        assertThat(first.source()).isEqualTo(IdentitySource.REMOTE_LOOKUP);
        assertThat(second.name()).isEqualTo("外部客户");
        verify(client, times(1)).lookupUser("e1");
        verify(client, times(1)).lookupExternalContact("e1");
        assertThat(cache.getRemoteHits()).containsEntry("e1", "外部客户");
        assertThat(cache.getRemoteCalls()).isEqualTo(1);
    }

    @Test
    void remoteLookupIsGatedPerId() {
        when(client.lookupUser("x1")).thenReturn(ContactLookup.failed(60111));
        when(client.lookupExternalContact("x1")).thenReturn(ContactLookup.failed(84061));
        when(client.lookupUser("x2")).thenReturn(new ContactLookup("成员二", 0));
        IdentityCache cache = new IdentityCache("host1", "主播", client, true);

        IdentityCache.Resolution miss1 = cache.resolve("x1", ParticipantKind.INTERNAL);
        IdentityCache.Resolution miss2 = cache.resolve("x1", ParticipantKind.INTERNAL);
        IdentityCache.Resolution other = cache.resolve("x2", ParticipantKind.INTERNAL);

        assertThat(miss1.found()).isFalse();
        assertThat(miss1.name()).isEqualTo("x1");
        assertThat(miss1.source()).isEqualTo(IdentitySource.FALLBACK);
        assertThat(miss2.found()).isFalse();
        assertThat(other.name()).isEqualTo("成员二");
        verify(client, times(1)).lookupUser("x1");
        verify(client, never()).lookupExternalContact("x2");
        assertThat(cache.getMisses()).isEqualTo(2);
        assertThat(cache.getRemoteCalls()).isEqualTo(2);
    }

    @Test
    void remoteFailureFallsBackToRawId() {
        when(client.lookupUser("x1")).thenThrow(new WeComApiException("WeCom corpId/corpSecret not configured"));
        IdentityCache cache = new IdentityCache("host1", "主播", client, true);

        IdentityCache.Resolution resolution = cache.resolve("x1", ParticipantKind.INTERNAL);

        assertThat(resolution.found()).isFalse();
        assertThat(resolution.name()).isEqualTo("x1");
        assertThat(cache.getRemoteHits()).isEmpty();
    }

    @Test
    void remoteLookupCanBeDisabled() {
        IdentityCache cache = new IdentityCache(null, null, client, false);

        assertThat(cache.resolve("x1", ParticipantKind.EXTERNAL).found()).isFalse();
        verifyNoInteractions(client);
    }
}
