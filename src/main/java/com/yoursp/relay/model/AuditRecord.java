package com.yoursp.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One line of the vault log. Written once, never rewritten.
 * The first {@code ingest}/{@code success} line for a vault ID holds that
 * entry's canonical digest.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuditRecord {

    /** ISO-8601 UTC instant. */
    private String timestamp;

    private AuditOperation operation;

    private String filename;

    /** Hex SHA-256; empty on failed retrievals. */
    private String contentDigest;

    private String vaultId;

    private AuditStatus status;

    private String error;

    private Long fileSize;

    @JsonIgnore
    public boolean isSuccessfulIngest() {
        return operation == AuditOperation.INGEST && status == AuditStatus.SUCCESS;
    }
}
