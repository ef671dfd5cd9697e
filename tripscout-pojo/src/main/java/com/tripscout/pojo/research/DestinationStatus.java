package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DestinationStatus {

    RESEARCHING("researching"),
    COMPLETED("completed"),
    /** 至少一个类别查询失败 */
    PARTIAL("partial"),
    FAILED("failed");

    private final String value;

    DestinationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * completed / partial 的目的地参与对比与推荐。
     */
    public boolean isRanked() {
        return this == COMPLETED || this == PARTIAL;
    }
}
