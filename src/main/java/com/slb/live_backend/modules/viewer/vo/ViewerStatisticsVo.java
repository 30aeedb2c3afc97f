package com.slb.live_backend.modules.viewer.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "单场直播观众统计")
public class ViewerStatisticsVo {
    private String livingId;
    private Long totalViewers;
    private Long internalViewers;
    private Long externalViewers;
    @Schema(description = "平均观看时长（秒）")
    private BigDecimal avgWatchSeconds;
    private Long commentedCount;
    private Long micCount;
    private Long signedCount;
    @Schema(description = "签到率（%），两位小数")
    private BigDecimal signRate;
    private Long totalSignCount;
    private BigDecimal avgSignCount;
    private Long rewardEligibleCount;
    private BigDecimal totalRewardAmount;

    @Schema(description = "有邀请人的观众数")
    private Long invitedCount;
    @Schema(description = "由企业成员邀请的观众数")
    private Long internalInvitedCount;
    @Schema(description = "由外部用户邀请的观众数")
    private Long externalInvitedCount;
    @Schema(description = "直接邀请：邀请人本身不是本场被邀请的观众")
    private Long directInvites;
    @Schema(description = "间接邀请：邀请人本身也是本场被邀请的观众")
    private Long indirectInvites;
    @Schema(description = "本场最长邀请链层数，无邀请时为 0")
    private Integer invitationDepth;
}
