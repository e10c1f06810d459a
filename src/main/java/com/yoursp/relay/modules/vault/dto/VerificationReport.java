package com.yoursp.relay.modules.vault.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of comparing a blob's current digest with the one recorded at ingest.
 * A mismatch is a normal result, not an error.
 */
@Getter
@Builder
public class VerificationReport {
    private final String vaultId;
    private final String filename;
    private final String originalDigest;
    private final String currentDigest;
    private final boolean match;
    private final long size;
    private final String checkedAt;
}
