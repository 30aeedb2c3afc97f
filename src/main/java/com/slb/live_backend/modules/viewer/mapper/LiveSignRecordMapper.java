package com.slb.live_backend.modules.viewer.mapper;

import com.slb.live_backend.modules.viewer.domain.SignAggregateRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface LiveSignRecordMapper {

    /**
     * 汇总有效签到：每个 (场次, 观众) 一行。
     */
    List<SignAggregateRow> aggregateValidByLivingIds(@Param("livingIds") Collection<String> livingIds);
}
