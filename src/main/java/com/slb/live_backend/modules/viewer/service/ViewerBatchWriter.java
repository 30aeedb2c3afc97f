package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.entity.LiveViewer;

import java.util.List;

/**
 * 对账线程独占的写会话：多次 flush，每次 flush 后提交。
 */
public interface ViewerBatchWriter extends AutoCloseable {

    void insert(List<LiveViewer> records);

    void update(List<LiveViewer> records);

    void commit();

    void rollback();

    @Override
    void close();
}
