package com.yoursp.relay.modules.integrity.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntegrityStatus {
    /** Digest matches the ingest record. */
    VERIFIED("verified"),
    /** Blob present but its digest changed. */
    CORRUPTED("corrupted"),
    /** Blob missing or the store failed to return it. */
    FAILED("failed"),
    /** Unexpected exception while checking. */
    ERROR("error");

    private final String value;

    IntegrityStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
