package com.yoursp.relay.modules.integrity;

import com.yoursp.relay.config.RelayProperties;
import com.yoursp.relay.model.AuditRecord;
import com.yoursp.relay.modules.integrity.dto.IntegrityCheckRecord;
import com.yoursp.relay.modules.integrity.dto.IntegrityFatalRecord;
import com.yoursp.relay.modules.integrity.dto.IntegrityRunReport;
import com.yoursp.relay.modules.integrity.dto.IntegrityStatus;
import com.yoursp.relay.modules.integrity.dto.IntegritySummaryRecord;
import com.yoursp.relay.service.ContentHasher;
import com.yoursp.relay.service.audit.IngestLookup;
import com.yoursp.relay.service.storage.BlobOutcome;
import com.yoursp.relay.service.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Batch re-verification of every successfully ingested file.
 * <p>
 * Files are checked one at a time in vault-log order. A single file's
 * failure is recorded and the run continues; only a failed connectivity
 * probe stops the run before any file is checked.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityAuditor {

    private final BlobStore blobStore;
    private final IngestLookup ingestLookup;
    private final ContentHasher contentHasher;
    private final IntegrityTrail trail;
    private final RelayProperties properties;

    /**
     * One run followed by pruning the trail, whatever the run's outcome.
     */
    public IntegrityRunReport runAndPrune() {
        try {
            return run();
        } catch (RuntimeException e) {
            log.error("Fatal error in integrity check: {}", e.getMessage(), e);
            trail.record(IntegrityFatalRecord.builder()
                    .timestamp(Instant.now().toString())
                    .checkType(IntegrityFatalRecord.CHECK_TYPE)
                    .error(String.valueOf(e.getMessage()))
                    .status("failed")
                    .build());
            return IntegrityRunReport.failed();
        } finally {
            trail.prune(properties.getIntegrity().getRetention());
        }
    }

    public IntegrityRunReport run() {
        log.info("Starting integrity check...");
        Instant start = Instant.now();

        if (!blobStore.isReachable()) {
            log.error("Cannot proceed - object store connectivity failed");
            return IntegrityRunReport.aborted();
        }

        List<AuditRecord> catalog = loadCatalog();
        if (catalog.isEmpty()) {
            log.info("No ingested files found in vault");
            return IntegrityRunReport.builder()
                    .outcome(IntegrityRunReport.Outcome.COMPLETED)
                    .durationSeconds(secondsSince(start))
                    .build();
        }

        log.info("Checking integrity of {} files...", catalog.size());
        int verified = 0;
        int failed = 0;
        for (AuditRecord entry : catalog) {
            if (check(entry) == IntegrityStatus.VERIFIED) {
                verified++;
            } else {
                failed++;
            }
        }

        double duration = secondsSince(start);
        trail.record(IntegritySummaryRecord.builder()
                .timestamp(Instant.now().toString())
                .checkType(IntegritySummaryRecord.CHECK_TYPE)
                .totalFiles(catalog.size())
                .verifiedFiles(verified)
                .failedFiles(failed)
                .durationSeconds(duration)
                .status("completed")
                .build());

        log.info("Integrity check completed: verified={}, failed={}, duration={}s",
                verified, failed, String.format("%.2f", duration));
        if (failed > 0) {
            log.warn("{} files failed integrity check!", failed);
        }

        return IntegrityRunReport.builder()
                .outcome(IntegrityRunReport.Outcome.COMPLETED)
                .totalFiles(catalog.size())
                .verifiedFiles(verified)
                .failedFiles(failed)
                .durationSeconds(duration)
                .build();
    }

    /**
     * Verify one catalog entry and append its outcome to the trail.
     */
    IntegrityStatus check(AuditRecord entry) {
        String vaultId = entry.getVaultId();
        String filename = entry.getFilename();
        String originalDigest = entry.getContentDigest();
        log.debug("Verifying: {}/{}", vaultId, filename);

        try {
            BlobOutcome<byte[]> blob = blobStore.get(vaultId, filename);
            if (!blob.isOk()) {
                String reason = blob.isNotFound() ? "File not found in blob store" : "Blob store read failed";
                return record(vaultId, filename, IntegrityStatus.FAILED, originalDigest, null, reason);
            }

            String currentDigest = contentHasher.digest(blob.getValue());
            if (currentDigest.equalsIgnoreCase(originalDigest)) {
                log.info("Integrity verified: {}/{}", vaultId, filename);
                return record(vaultId, filename, IntegrityStatus.VERIFIED, originalDigest, currentDigest, null);
            }
            log.error("Integrity FAILED: {}/{} - hash mismatch", vaultId, filename);
            return record(vaultId, filename, IntegrityStatus.CORRUPTED, originalDigest, currentDigest,
                    "Hash mismatch");
        } catch (RuntimeException e) {
            log.error("Error verifying {}/{}: {}", vaultId, filename, e.getMessage());
            return record(vaultId, filename, IntegrityStatus.ERROR, originalDigest, null,
                    String.valueOf(e.getMessage()));
        }
    }

    private IntegrityStatus record(String vaultId, String filename, IntegrityStatus status,
            String originalDigest, String currentDigest, String error) {
        trail.record(IntegrityCheckRecord.of(vaultId, filename, status, originalDigest, currentDigest, error));
        return status;
    }

    private List<AuditRecord> loadCatalog() {
        try {
            return ingestLookup.successfulIngests();
        } catch (IOException e) {
            log.warn("Vault log unreadable, treating catalog as empty: {}", e.getMessage());
            return List.of();
        }
    }

    private static double secondsSince(Instant start) {
        return Duration.between(start, Instant.now()).toMillis() / 1000.0;
    }
}
