package com.slb.live_backend.modules.reward.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * 红包奖励规则。三个条件：
 * 签到（单场签到次数 ≥ 阈值）、时长（单场观看秒数 ≥ 阈值）、场次（所选场次中出现的场数 ≥ 阈值）。
 * 落库保存 {@link #getCode()}。
 */
public enum RewardRuleType {
    SIGN("sign", "仅签到次数"),
    WATCH("watch", "仅观看时长"),
    COUNT("count", "仅观看场次"),
    SIGN_WATCH("sign-watch", "签到次数且观看时长"),
    SIGN_COUNT("sign-count", "签到次数且观看场次"),
    WATCH_COUNT("watch-count", "观看时长且观看场次"),
    ANY_OF("all-or", "满足任一条件"),
    ALL_OF("all-and", "满足全部条件");

    private final String code;
    private final String description;

    RewardRuleType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSatisfied(boolean signMet, boolean watchMet, boolean countMet) {
        return switch (this) {
            case SIGN -> signMet;
            case WATCH -> watchMet;
            case COUNT -> countMet;
            case SIGN_WATCH -> signMet && watchMet;
            case SIGN_COUNT -> signMet && countMet;
            case WATCH_COUNT -> watchMet && countMet;
            case ANY_OF -> signMet || watchMet || countMet;
            case ALL_OF -> signMet && watchMet && countMet;
        };
    }

    public static Optional<RewardRuleType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
