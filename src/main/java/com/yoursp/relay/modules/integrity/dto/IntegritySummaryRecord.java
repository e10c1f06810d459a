package com.yoursp.relay.modules.integrity.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Closing line of a completed integrity run.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntegritySummaryRecord {

    public static final String CHECK_TYPE = "integrity_summary";

    private String timestamp;
    private String checkType;
    private int totalFiles;
    private int verifiedFiles;
    private int failedFiles;
    private double durationSeconds;
    private String status;
}
