package com.slb.live_backend.modules.reward.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.reward")
@Data
public class RewardProperties {

    private int insertChunkSize = 1000;
    private int consistencySampleSize = 2;
    private String defaultOperator = "system";
    private String statusEligible = "PENDING";
    private String statusIneligible = "INELIGIBLE";
}
