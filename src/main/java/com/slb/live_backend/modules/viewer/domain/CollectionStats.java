package com.slb.live_backend.modules.viewer.domain;

/**
 * @param fatal   第一页即失败，本次同步不处理任何数据
 * @param partial 后续页失败或被中止，已入队的数据照常处理
 */
public record CollectionStats(int pages,
                              int internalPublished,
                              int externalPublished,
                              boolean fatal,
                              boolean partial,
                              String error) {

    public int published() {
        return internalPublished + externalPublished;
    }
}
