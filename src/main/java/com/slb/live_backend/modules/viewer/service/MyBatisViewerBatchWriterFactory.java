package com.slb.live_backend.modules.viewer.service;

import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.mapper.LiveViewerMapper;
import org.apache.ibatis.session.ExecutorType;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 基于 MyBatis BATCH 执行器的写会话：关闭自动提交，insert 为多行插入，update 逐条进入 JDBC 批。
 * 每个对账线程打开一个独立的 SqlSession，不参与 Spring 事务。
 */
@Component
public class MyBatisViewerBatchWriterFactory implements ViewerBatchWriterFactory {

    private final SqlSessionFactory sqlSessionFactory;

    public MyBatisViewerBatchWriterFactory(SqlSessionFactory sqlSessionFactory) {
        this.sqlSessionFactory = sqlSessionFactory;
    }

    @Override
    public ViewerBatchWriter open() {
        return new SessionWriter(sqlSessionFactory.openSession(ExecutorType.BATCH, false));
    }

    private static final class SessionWriter implements ViewerBatchWriter {

        private final SqlSession session;
        private final LiveViewerMapper mapper;

        private SessionWriter(SqlSession session) {
            this.session = session;
            this.mapper = session.getMapper(LiveViewerMapper.class);
        }

        @Override
        public void insert(List<LiveViewer> records) {
            if (records.isEmpty()) {
                return;
            }
            mapper.insertBatch(records);
        }

        @Override
        public void update(List<LiveViewer> records) {
            for (LiveViewer record : records) {
                mapper.updateAttendance(record);
            }
        }

        @Override
        public void commit() {
            session.flushStatements();
            session.commit();
        }

        @Override
        public void rollback() {
            session.rollback();
        }

        @Override
        public void close() {
            session.close();
        }
    }
}
