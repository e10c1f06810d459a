package com.yoursp.relay.modules.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class RetrievedBlob {
    private final String vaultId;
    private final String filename;
    private final byte[] content;
    /** Digest of the bytes as read now; not compared against the ingest digest. */
    private final String contentDigest;
}
