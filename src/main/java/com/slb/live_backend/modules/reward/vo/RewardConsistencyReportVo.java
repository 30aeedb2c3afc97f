package com.slb.live_backend.modules.reward.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 已落库的奖励记录与当前规则的一致性报告。不一致只作提示，不影响数据。
 */
@Data
public class RewardConsistencyReportVo {
    private boolean consistent;
    private Integer checkedSessions;
    private Integer sampledRecords;
    private List<String> sessionsWithoutRecords = new ArrayList<>();
    private Set<String> batchIds = new LinkedHashSet<>();
    private List<Mismatch> mismatches = new ArrayList<>();

    public record Mismatch(String livingId, Long viewerId, String field, String expected, String actual) {
    }
}
