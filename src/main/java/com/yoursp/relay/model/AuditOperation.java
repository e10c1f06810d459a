package com.yoursp.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditOperation {
    INGEST("ingest"),
    RETRIEVE("retrieve");

    private final String value;

    AuditOperation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
