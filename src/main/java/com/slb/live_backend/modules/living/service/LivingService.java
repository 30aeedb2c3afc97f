package com.slb.live_backend.modules.living.service;

import com.slb.live_backend.common.exception.BizException;
import com.slb.live_backend.modules.living.entity.Living;
import com.slb.live_backend.modules.living.mapper.LivingMapper;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Service
public class LivingService {

    private final LivingMapper livingMapper;

    public LivingService(LivingMapper livingMapper) {
        this.livingMapper = livingMapper;
    }

    public Optional<Living> findByLivingId(String livingId) {
        if (!StringUtils.hasText(livingId)) {
            return Optional.empty();
        }
        return livingMapper.selectByLivingId(livingId);
    }

    public Living requireByLivingId(String livingId) {
        return findByLivingId(livingId)
                .orElseThrow(() -> new BizException(404, "直播场次不存在: " + livingId));
    }
}
