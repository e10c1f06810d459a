package com.yoursp.relay.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.relay.config.RelayProperties;
import com.yoursp.relay.model.AuditOperation;
import com.yoursp.relay.model.AuditRecord;
import com.yoursp.relay.model.AuditStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Service for recording vault audit trail entries.
 * Called from every ingest and retrieval. The log is the single source of
 * truth for what was ingested and with which digest.
 */
@Slf4j
@Service
public class VaultAuditLog implements IngestLookup {

    private final JsonLinesFile file;

    @Autowired
    public VaultAuditLog(RelayProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getAudit().getVaultLog()), objectMapper);
    }

    public VaultAuditLog(Path logFile, ObjectMapper objectMapper) {
        this.file = new JsonLinesFile(logFile, objectMapper);
    }

    /**
     * Record a vault operation.
     *
     * @param operation ingest or retrieve
     * @param filename  sanitized filename
     * @param digest    hex SHA-256, empty when nothing was read
     * @param vaultId   the vault entry concerned
     * @param status    success or failed
     * @param error     failure reason (nullable)
     * @param fileSize  bytes involved (nullable)
     */
    public void log(AuditOperation operation, String filename, String digest, String vaultId,
            AuditStatus status, String error, Long fileSize) {
        append(AuditRecord.builder()
                .timestamp(Instant.now().toString())
                .operation(operation)
                .filename(filename)
                .contentDigest(digest)
                .vaultId(vaultId)
                .status(status)
                .error(error)
                .fileSize(fileSize)
                .build());
    }

    public void append(AuditRecord record) {
        try {
            file.append(record);
            log.debug("Audit logged: operation={}, vaultId={}, status={}",
                    record.getOperation(), record.getVaultId(), record.getStatus());
        } catch (IOException e) {
            // the user operation already happened; losing the line is reported, not propagated
            log.error("Failed to write to vault log {}: operation={}, vaultId={}, error={}",
                    file.getPath(), record.getOperation(), record.getVaultId(), e.getMessage());
        }
    }

    @Override
    public Optional<AuditRecord> findIngestRecord(String vaultId) {
        return scan(r -> r.isSuccessfulIngest() && vaultId.equals(r.getVaultId()));
    }

    @Override
    public Optional<AuditRecord> findIngestRecord(String vaultId, String filename) {
        return scan(r -> r.isSuccessfulIngest()
                && vaultId.equals(r.getVaultId())
                && filename.equals(r.getFilename()));
    }

    @Override
    public List<AuditRecord> successfulIngests() throws IOException {
        return file.readAll(AuditRecord.class).stream()
                .filter(AuditRecord::isSuccessfulIngest)
                .toList();
    }

    private Optional<AuditRecord> scan(Predicate<AuditRecord> filter) {
        try {
            return file.findFirst(AuditRecord.class, filter);
        } catch (IOException e) {
            log.error("Failed to read vault log {}: {}", file.getPath(), e.getMessage());
            return Optional.empty();
        }
    }
}
