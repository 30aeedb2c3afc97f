package com.slb.live_backend.modules.viewer.service;

public interface ViewerBatchWriterFactory {

    ViewerBatchWriter open();
}
