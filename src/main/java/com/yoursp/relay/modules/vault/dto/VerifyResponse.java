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
public class VerifyResponse {
    private final String vaultId;
    private final String filename;
    private final String originalHash;
    private final String currentHash;
    private final boolean integrityVerified;
    private final long fileSize;
    private final String timestamp;

    public static VerifyResponse from(VerificationReport report) {
        return VerifyResponse.builder()
                .vaultId(report.getVaultId())
                .filename(report.getFilename())
                .originalHash(report.getOriginalDigest())
                .currentHash(report.getCurrentDigest())
                .integrityVerified(report.isMatch())
                .fileSize(report.getSize())
                .timestamp(report.getCheckedAt())
                .build();
    }
}
