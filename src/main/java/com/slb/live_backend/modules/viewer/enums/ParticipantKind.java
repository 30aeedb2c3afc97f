package com.slb.live_backend.modules.viewer.enums;

/**
 * 观众类型：企业成员 / 外部用户。按名称落库。
 */
public enum ParticipantKind {
    INTERNAL("企业成员"),
    EXTERNAL("外部用户");

    private final String label;

    ParticipantKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
