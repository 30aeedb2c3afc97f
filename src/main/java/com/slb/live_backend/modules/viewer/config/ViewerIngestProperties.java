package com.slb.live_backend.modules.viewer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.viewer")
@Data
public class ViewerIngestProperties {

    /**
     * 新增/更新批次达到该条数即落库。
     */
    private int batchSize = 1000;
    /**
     * 企业成员、外部用户两个队列各自的容量；队列满时拉取线程阻塞等待。
     */
    private int queueCapacity = 2000;
    private long queuePollMs = 200L;
    /**
     * 每拉取 N 页暂停一次，配合企业微信接口频率限制。
     */
    private int pagesPerPause = 5;
    private long pagePauseMs = 500L;
    private int maxPages = 10_000;
    /**
     * 单次同步的整体超时，超时后取消拉取与对账。
     */
    private long runTimeoutMs = 600_000L;
    private int backfillChunkSize = 1000;
    private boolean remoteLookupEnabled = true;
}
