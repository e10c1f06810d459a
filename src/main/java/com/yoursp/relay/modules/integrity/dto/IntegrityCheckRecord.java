package com.yoursp.relay.modules.integrity.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Per-file outcome line in the integrity trail.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntegrityCheckRecord {

    public static final String CHECK_TYPE = "integrity_verification";

    private String timestamp;
    private String checkType;
    private String vaultId;
    private String filename;
    private IntegrityStatus status;
    private String originalDigest;
    private String currentDigest;
    /** Null unless both digests are known. */
    private Boolean match;
    private String error;

    public static IntegrityCheckRecord of(String vaultId, String filename, IntegrityStatus status,
            String originalDigest, String currentDigest, String error) {
        Boolean match = originalDigest != null && currentDigest != null
                ? originalDigest.equalsIgnoreCase(currentDigest)
                : null;
        return IntegrityCheckRecord.builder()
                .timestamp(Instant.now().toString())
                .checkType(CHECK_TYPE)
                .vaultId(vaultId)
                .filename(filename)
                .status(status)
                .originalDigest(originalDigest)
                .currentDigest(currentDigest)
                .match(match)
                .error(error)
                .build();
    }
}
