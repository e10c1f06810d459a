package com.yoursp.relay.modules.vault;

import com.yoursp.relay.config.RelayProperties;
import com.yoursp.relay.model.AuditOperation;
import com.yoursp.relay.model.AuditStatus;
import com.yoursp.relay.model.ErrorKind;
import com.yoursp.relay.model.VaultEntry;
import com.yoursp.relay.model.VaultOutcome;
import com.yoursp.relay.service.ContentHasher;
import com.yoursp.relay.service.audit.VaultAuditLog;
import com.yoursp.relay.service.storage.BlobOutcome;
import com.yoursp.relay.service.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Stores an uploaded file under a fresh vault ID and records its digest.
 *
 * <h3>Flow:</h3>
 * <ol>
 * <li>Sanitize filename, enforce size limit</li>
 * <li>SHA-256 of the full content</li>
 * <li>Random UUID vault ID</li>
 * <li>Put blob, then append the ingest record with the resulting status</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {

    private final BlobStore blobStore;
    private final VaultAuditLog auditLog;
    private final ContentHasher contentHasher;
    private final RelayProperties properties;

    public VaultOutcome<VaultEntry> ingest(String originalFilename, byte[] content) {
        if (content == null) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "No file provided");
        }

        String filename = FilenameSanitizer.sanitize(originalFilename);
        if (filename.isEmpty()) {
            log.warn("Rejected upload with unusable filename");
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid filename");
        }

        long maxBytes = properties.getMaxUploadBytes();
        if (content.length > maxBytes) {
            log.warn("Rejected upload {} ({} bytes > limit {})", filename, content.length, maxBytes);
            return VaultOutcome.failure(ErrorKind.PAYLOAD_TOO_LARGE,
                    "File exceeds maximum size of " + maxBytes + " bytes");
        }

        String digest = contentHasher.digest(content);
        String vaultId = VaultIds.newId();
        long size = content.length;

        BlobOutcome<Void> stored = blobStore.put(vaultId, filename, content);
        if (!stored.isOk()) {
            auditLog.log(AuditOperation.INGEST, filename, digest, vaultId,
                    AuditStatus.FAILED, "Upload to blob store failed", size);
            return VaultOutcome.failure(ErrorKind.STORAGE, "Failed to store file in vault");
        }

        auditLog.log(AuditOperation.INGEST, filename, digest, vaultId, AuditStatus.SUCCESS, null, size);
        log.info("File ingested: {} - {} ({} bytes)", vaultId, filename, size);

        return VaultOutcome.success(VaultEntry.builder()
                .vaultId(vaultId)
                .filename(filename)
                .contentDigest(digest)
                .size(size)
                .createdAt(Instant.now().toString())
                .build());
    }
}
