package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.viewer.enums.IdentitySource;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import com.slb.live_backend.modules.wecom.domain.ContactLookup;
import com.slb.live_backend.modules.wecom.domain.LivePlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单次同步内的身份缓存：原始 id（企业成员 userid 或外部用户 external_userid）→ 展示名称。
 * <p>
 * 解析顺序：主播 → 本地库预加载 → 当前接口页 → 远程查询（每个 id 至多一次，仅用于邀请人）→ 以 id 兜底。
 * 两个对账线程共享同一实例，所有状态均为并发容器。
 */
@Slf4j
public class IdentityCache {

    private final String hostId;
    private final String hostName;
    private final LivePlatformClient client;
    private final boolean remoteEnabled;

    private final Map<String, Entry> resolved = new ConcurrentHashMap<>();
    private final Map<String, String> pageHints = new ConcurrentHashMap<>();
    private final Set<String> remoteAttempted = ConcurrentHashMap.newKeySet();
    private final Map<String, String> remoteHits = new ConcurrentHashMap<>();
    private final AtomicInteger remoteCalls = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public record Entry(String name, IdentitySource source) {
    }

    public record Resolution(String name, boolean found, IdentitySource source) {
    }

    public IdentityCache(String hostId, String hostName, LivePlatformClient client, boolean remoteEnabled) {
        this.hostId = hostId;
        this.hostName = StringUtils.hasText(hostName) ? hostName : hostId;
        this.client = client;
        this.remoteEnabled = remoteEnabled && client != null;
    }

    public boolean isHost(String id) {
        return StringUtils.hasText(hostId) && hostId.equals(id);
    }

    public String getHostName() {
        return hostName;
    }

    public void preload(String id, String name) {
        if (StringUtils.hasText(id) && StringUtils.hasText(name)) {
            resolved.putIfAbsent(id, new Entry(name, IdentitySource.LOCAL_STORE));
        }
    }

    public void registerPageHint(String id, String name) {
        if (StringUtils.hasText(id) && StringUtils.hasText(name)) {
            pageHints.put(id, name);
        }
    }

    /**
     * 邀请人解析，按完整顺序，包括远程查询。
     */
    public Resolution resolve(String id, ParticipantKind kindHint) {
        Resolution local = resolveLocal(id);
        if (local.found() || !StringUtils.hasText(id)) {
            return local;
        }
        String remote = lookupRemote(id, kindHint);
        if (remote != null) {
            resolved.put(id, new Entry(remote, IdentitySource.REMOTE_LOOKUP));
            remoteHits.put(id, remote);
            return new Resolution(remote, true, IdentitySource.REMOTE_LOOKUP);
        }
        misses.incrementAndGet();
        log.debug("Identity resolution miss, falling back to raw id (id={}, kind={})", id, kindHint);
        return new Resolution(id, false, IdentitySource.FALLBACK);
    }

    /**
     * 只查主播、本地库预加载和接口页，不发远程请求，也不计入未命中。
     * 观众本人的昵称走这里：对账主循环里不做逐条远程查询。
     */
    public Resolution resolveLocal(String id) {
        if (!StringUtils.hasText(id)) {
            return new Resolution(id, false, IdentitySource.FALLBACK);
        }
        if (isHost(id)) {
            return new Resolution(hostName, true, IdentitySource.HOST);
        }
        Entry entry = resolved.get(id);
        if (entry != null) {
            return new Resolution(entry.name(), true, entry.source());
        }
        String hinted = pageHints.get(id);
        if (hinted != null) {
            resolved.put(id, new Entry(hinted, IdentitySource.API_PAGE));
            return new Resolution(hinted, true, IdentitySource.API_PAGE);
        }
        return new Resolution(id, false, IdentitySource.FALLBACK);
    }

    /**
     * 远程查询按 id 门控：同一 id 在本次同步内只尝试一次，先查企业成员，再查外部联系人。
     */
    private String lookupRemote(String id, ParticipantKind kindHint) {
        if (!remoteEnabled || !remoteAttempted.add(id)) {
            return null;
        }
        remoteCalls.incrementAndGet();
        try {
            ContactLookup user = client.lookupUser(id);
            if (user != null && user.isFound()) {
                return user.name();
            }
            ContactLookup contact = client.lookupExternalContact(id);
            if (contact != null && contact.isFound()) {
                return contact.name();
            }
            log.info("Remote identity lookup found nothing (id={}, kind={}, userErrcode={}, contactErrcode={})",
                    id, kindHint, user != null ? user.errcode() : null, contact != null ? contact.errcode() : null);
        } catch (RuntimeException ex) {
            log.warn("Remote identity lookup failed (id={}, kind={}, message={})", id, kindHint, ex.getMessage());
        }
        return null;
    }

    public Map<String, String> getRemoteHits() {
        return Collections.unmodifiableMap(remoteHits);
    }

    public int getRemoteCalls() {
        return remoteCalls.get();
    }

    public int getMisses() {
        return misses.get();
    }
}
