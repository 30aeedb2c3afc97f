package com.slb.live_backend.modules.viewer.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignRefreshResultVo {
    private String livingId;
    private Integer signed;   // 有有效签到的观众
    private Integer reset;    // 无签到记录、被重置的观众
    private Integer errors;
}
