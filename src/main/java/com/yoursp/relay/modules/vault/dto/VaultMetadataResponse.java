package com.yoursp.relay.modules.vault.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VaultMetadataResponse {
    private final String vaultId;
    private final String filename;
    private final String contentDigest;
    private final Long fileSize;
    /** When the entry was ingested. */
    private final String timestamp;
    private final String status;
}
