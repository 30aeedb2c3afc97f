package com.slb.live_backend.modules.reward.mapper;

import com.slb.live_backend.modules.reward.entity.LiveRewardRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface LiveRewardRecordMapper {

    int deleteByLivingIds(@Param("livingIds") Collection<String> livingIds);

    int insertBatch(@Param("records") List<LiveRewardRecord> records);

    /**
     * 每场抽取最多 limit 条用于一致性检查。
     */
    List<LiveRewardRecord> selectSampleByLivingId(@Param("livingId") String livingId, @Param("limit") int limit);
}
