package com.slb.live_backend.modules.viewer.domain;

import com.slb.live_backend.modules.living.entity.Living;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.enums.ParticipantKind;
import lombok.Getter;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次观众同步的上下文：身份缓存、已存在观众索引、两个有界队列、截止时间与取消标记。
 * 不跨次复用，不放任何全局状态。
 */
public class IngestionRun {

    @Getter
    private final String livingId;
    @Getter
    private final Living living;
    @Getter
    private final String traceId;
    @Getter
    private final IdentityCache identityCache;
    @Getter
    private final ConcurrentMap<ViewerKey, LiveViewer> existingIndex = new ConcurrentHashMap<>();
    @Getter
    private final long deadlineMillis;

    private final BlockingQueue<ParticipantMessage> internalQueue;
    private final BlockingQueue<ParticipantMessage> externalQueue;
    private final long pollMillis;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public IngestionRun(String livingId,
                        Living living,
                        String traceId,
                        IdentityCache identityCache,
                        int queueCapacity,
                        long pollMillis,
                        long timeoutMillis) {
        this.livingId = livingId;
        this.living = living;
        this.traceId = traceId;
        this.identityCache = identityCache;
        this.internalQueue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.externalQueue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.pollMillis = Math.max(1L, pollMillis);
        this.deadlineMillis = System.currentTimeMillis() + Math.max(1L, timeoutMillis);
    }

    public void indexExisting(LiveViewer viewer) {
        existingIndex.put(ViewerKey.of(viewer.getParticipantKind(), viewer.getParticipantId()), viewer);
    }

    public BlockingQueue<ParticipantMessage> queueFor(ParticipantKind kind) {
        return kind == ParticipantKind.EXTERNAL ? externalQueue : internalQueue;
    }

    public boolean isHost(String participantId) {
        return identityCache.isHost(participantId);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return System.currentTimeMillis() >= deadlineMillis;
    }

    public boolean isStopped() {
        return cancelled.get() || isExpired();
    }

    public long remainingMillis() {
        return Math.max(0L, deadlineMillis - System.currentTimeMillis());
    }

    /**
     * 有界阻塞入队：队列满时分片等待，直到成功、超时或被取消。
     *
     * @return false 表示本次同步已停止，消息未入队
     */
    public boolean publish(ParticipantKind kind, ParticipantMessage message) throws InterruptedException {
        BlockingQueue<ParticipantMessage> queue = queueFor(kind);
        while (!isStopped()) {
            if (queue.offer(message, pollMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 推送结束标记。调用方可能已被中断，此时只做一次非阻塞尝试。
     */
    public void publishEnd(ParticipantKind kind) {
        try {
            publish(kind, ParticipantMessage.END);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            queueFor(kind).offer(ParticipantMessage.END);
        }
    }

    /**
     * 有界阻塞出队。
     *
     * @return 下一条消息；本次同步已停止时返回 null
     */
    public ParticipantMessage next(ParticipantKind kind) throws InterruptedException {
        BlockingQueue<ParticipantMessage> queue = queueFor(kind);
        while (!isStopped()) {
            ParticipantMessage message = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
        }
        return null;
    }

    /**
     * 对账中止后继续消费直到结束标记，避免拉取线程阻塞在满队列上。
     *
     * @return 丢弃的消息条数
     */
    public int drain(ParticipantKind kind) throws InterruptedException {
        int dropped = 0;
        ParticipantMessage message;
        while ((message = next(kind)) != null && !message.isEnd()) {
            dropped++;
        }
        return dropped;
    }
}
