package com.slb.live_backend.modules.viewer.domain;

import lombok.Data;

@Data
public class IdNameRow {
    private String id;
    private String name;
}
