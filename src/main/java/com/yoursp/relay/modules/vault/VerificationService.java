package com.yoursp.relay.modules.vault;

import com.yoursp.relay.model.AuditRecord;
import com.yoursp.relay.model.ErrorKind;
import com.yoursp.relay.model.VaultOutcome;
import com.yoursp.relay.modules.vault.dto.VerificationReport;
import com.yoursp.relay.service.ContentHasher;
import com.yoursp.relay.service.audit.IngestLookup;
import com.yoursp.relay.service.storage.BlobOutcome;
import com.yoursp.relay.service.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Optional;

/**
 * On-demand integrity check of one vault entry against its ingest digest.
 * Writes nothing to the vault log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    private final BlobStore blobStore;
    private final IngestLookup ingestLookup;
    private final ContentHasher contentHasher;

    public VaultOutcome<VerificationReport> verify(String vaultId, String filename) {
        if (!VaultIds.isValid(vaultId)) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid vault ID format");
        }
        if (!StringUtils.hasText(filename)) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Filename required for verification");
        }
        if (!filename.equals(FilenameSanitizer.sanitize(filename))) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid filename");
        }
        String id = VaultIds.normalize(vaultId);

        BlobOutcome<byte[]> blob = blobStore.get(id, filename);
        if (!blob.isOk()) {
            return VaultOutcome.failure(ErrorKind.NOT_FOUND, "File not found in vault");
        }
        byte[] content = blob.getValue();
        String currentDigest = contentHasher.digest(content);

        Optional<AuditRecord> ingest = ingestLookup.findIngestRecord(id, filename);
        if (ingest.isEmpty() || !StringUtils.hasText(ingest.get().getContentDigest())) {
            return VaultOutcome.failure(ErrorKind.NOT_FOUND, "Original hash not found in vault log");
        }
        String originalDigest = ingest.get().getContentDigest();

        boolean match = originalDigest.equalsIgnoreCase(currentDigest);
        if (match) {
            log.info("Integrity verified: {}/{}", id, filename);
        } else {
            log.warn("Integrity mismatch: {}/{} original={} current={}", id, filename, originalDigest, currentDigest);
        }

        return VaultOutcome.success(VerificationReport.builder()
                .vaultId(id)
                .filename(filename)
                .originalDigest(originalDigest)
                .currentDigest(currentDigest)
                .match(match)
                .size(content.length)
                .checkedAt(Instant.now().toString())
                .build());
    }
}
