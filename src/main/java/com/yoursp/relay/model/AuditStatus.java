package com.yoursp.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    AuditStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
