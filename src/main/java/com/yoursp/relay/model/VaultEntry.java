package com.yoursp.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A stored file as the vault knows it. {@code contentDigest} is fixed at
 * ingest and only ever compared against, never replaced.
 */
@Getter
@Builder
@AllArgsConstructor
public class VaultEntry {
    private final String vaultId;
    private final String filename;
    private final String contentDigest;
    private final Long size;
    private final String createdAt;

    public static VaultEntry fromIngestRecord(AuditRecord record) {
        return VaultEntry.builder()
                .vaultId(record.getVaultId())
                .filename(record.getFilename())
                .contentDigest(record.getContentDigest())
                .size(record.getFileSize())
                .createdAt(record.getTimestamp())
                .build();
    }
}
