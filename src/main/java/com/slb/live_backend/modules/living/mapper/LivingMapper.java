package com.slb.live_backend.modules.living.mapper;

import com.slb.live_backend.modules.living.entity.Living;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface LivingMapper {

    Optional<Living> selectByLivingId(@Param("livingId") String livingId);
}
