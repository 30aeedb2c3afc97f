package com.slb.live_backend.modules.viewer.mapper;

import com.slb.live_backend.modules.viewer.entity.InvitorCache;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface InvitorCacheMapper {

    List<InvitorCache> selectAll();

    List<InvitorCache> selectByIds(@Param("ids") Collection<String> ids);

    int upsertBatch(@Param("records") List<InvitorCache> records);
}
