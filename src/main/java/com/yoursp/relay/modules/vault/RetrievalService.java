package com.yoursp.relay.modules.vault;

import com.yoursp.relay.model.AuditOperation;
import com.yoursp.relay.model.AuditStatus;
import com.yoursp.relay.model.ErrorKind;
import com.yoursp.relay.model.VaultEntry;
import com.yoursp.relay.model.VaultOutcome;
import com.yoursp.relay.modules.vault.dto.RetrievedBlob;
import com.yoursp.relay.service.ContentHasher;
import com.yoursp.relay.service.audit.VaultAuditLog;
import com.yoursp.relay.service.storage.BlobOutcome;
import com.yoursp.relay.service.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Serves vault entries back: metadata from the vault log, or the raw bytes.
 * <p>
 * A download recomputes the digest for the audit trail only. It is not
 * compared with the ingest digest here; mismatched content is still returned.
 * {@link VerificationService} does the comparison.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private final BlobStore blobStore;
    private final VaultAuditLog auditLog;
    private final ContentHasher contentHasher;

    public VaultOutcome<VaultEntry> metadata(String vaultId) {
        if (!VaultIds.isValid(vaultId)) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid vault ID format");
        }
        return auditLog.findIngestRecord(VaultIds.normalize(vaultId))
                .map(VaultEntry::fromIngestRecord)
                .map(VaultOutcome::success)
                .orElseGet(() -> VaultOutcome.failure(ErrorKind.NOT_FOUND, "Vault ID not found"));
    }

    public VaultOutcome<RetrievedBlob> retrieve(String vaultId, String filename) {
        if (!VaultIds.isValid(vaultId)) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid vault ID format");
        }
        if (!StringUtils.hasText(filename)) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Filename required for file retrieval");
        }
        // blobs are only ever stored under sanitized names
        if (!filename.equals(FilenameSanitizer.sanitize(filename))) {
            return VaultOutcome.failure(ErrorKind.VALIDATION, "Invalid filename");
        }
        String id = VaultIds.normalize(vaultId);

        BlobOutcome<byte[]> blob = blobStore.get(id, filename);
        if (!blob.isOk()) {
            auditLog.log(AuditOperation.RETRIEVE, filename, "", id,
                    AuditStatus.FAILED, "File not found in vault", null);
            return VaultOutcome.failure(ErrorKind.NOT_FOUND, "File not found in vault");
        }

        byte[] content = blob.getValue();
        String digest = contentHasher.digest(content);
        auditLog.log(AuditOperation.RETRIEVE, filename, digest, id, AuditStatus.SUCCESS, null, (long) content.length);
        log.info("File retrieved: {} - {} ({} bytes)", id, filename, content.length);

        return VaultOutcome.success(RetrievedBlob.builder()
                .vaultId(id)
                .filename(filename)
                .content(content)
                .contentDigest(digest)
                .build());
    }
}
