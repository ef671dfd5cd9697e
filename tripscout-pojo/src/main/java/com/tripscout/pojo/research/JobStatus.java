package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调研任务状态：pending -> in_progress -> completed | failed。
 */
public enum JobStatus {

    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus of(String value) {
        for (JobStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown job status: " + value);
    }
}
