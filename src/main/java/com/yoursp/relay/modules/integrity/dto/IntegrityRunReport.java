package com.yoursp.relay.modules.integrity.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * What one auditor run did. Returned to the caller; the trail holds the details.
 */
@Getter
@Builder
public class IntegrityRunReport {

    public enum Outcome {
        COMPLETED,
        /** Connectivity probe failed, nothing checked. */
        ABORTED,
        /** Run died with an unexpected exception. */
        FAILED
    }

    private final Outcome outcome;
    private final int totalFiles;
    private final int verifiedFiles;
    private final int failedFiles;
    private final double durationSeconds;

    public static IntegrityRunReport aborted() {
        return IntegrityRunReport.builder().outcome(Outcome.ABORTED).build();
    }

    public static IntegrityRunReport failed() {
        return IntegrityRunReport.builder().outcome(Outcome.FAILED).build();
    }
}
