package com.yoursp.relay.modules.vault;

import com.yoursp.relay.model.ErrorKind;
import com.yoursp.relay.model.VaultEntry;
import com.yoursp.relay.model.VaultOutcome;
import com.yoursp.relay.modules.vault.dto.IngestResponse;
import com.yoursp.relay.modules.vault.dto.RetrievedBlob;
import com.yoursp.relay.modules.vault.dto.VaultMetadataResponse;
import com.yoursp.relay.modules.vault.dto.VerificationReport;
import com.yoursp.relay.modules.vault.dto.VerifyResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

/**
 * Controller for vault operations.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /ingest: Upload a file, returns its vault ID</li>
 * <li>GET /vault/{vaultId}: Download a file, or its metadata with metadata_only=true</li>
 * <li>GET /vault/{vaultId}/verify: Compare current digest with the ingest digest</li>
 * </ul>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class VaultController {

    private final IngestService ingestService;
    private final RetrievalService retrievalService;
    private final VerificationService verificationService;

    // ================================================================
    // POST /ingest
    // ================================================================

    @PostMapping("/ingest")
    public ResponseEntity<?> ingest(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null) {
            return errorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "No file provided");
        }
        if (file.getOriginalFilename() == null || file.getOriginalFilename().isEmpty()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "No file selected");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read uploaded file: {}", e.getMessage());
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                    "Internal server error during ingestion");
        }

        VaultOutcome<VaultEntry> outcome = ingestService.ingest(file.getOriginalFilename(), content);
        if (!outcome.isSuccess()) {
            return failure(outcome);
        }

        VaultEntry entry = outcome.getValue();
        return ResponseEntity.ok(IngestResponse.builder()
                .status("success")
                .vaultId(entry.getVaultId())
                .filename(entry.getFilename())
                .contentDigest(entry.getContentDigest())
                .fileSize(entry.getSize())
                .timestamp(entry.getCreatedAt())
                .build());
    }

    // ================================================================
    // GET /vault/{vaultId}
    // ================================================================

    @GetMapping("/vault/{vaultId}")
    public ResponseEntity<?> retrieve(@PathVariable String vaultId,
            @RequestParam(value = "filename", required = false) String filename,
            @RequestParam(value = "metadata_only", defaultValue = "false") String metadataOnly) {
        if ("true".equalsIgnoreCase(metadataOnly)) {
            VaultOutcome<VaultEntry> outcome = retrievalService.metadata(vaultId);
            if (!outcome.isSuccess()) {
                return failure(outcome);
            }
            VaultEntry entry = outcome.getValue();
            return ResponseEntity.ok(VaultMetadataResponse.builder()
                    .vaultId(entry.getVaultId())
                    .filename(entry.getFilename())
                    .contentDigest(entry.getContentDigest())
                    .fileSize(entry.getSize())
                    .timestamp(entry.getCreatedAt())
                    .status("success")
                    .build());
        }

        VaultOutcome<RetrievedBlob> outcome = retrievalService.retrieve(vaultId, filename);
        if (!outcome.isSuccess()) {
            return failure(outcome);
        }

        RetrievedBlob blob = outcome.getValue();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(blob.getFilename())
                .build());
        headers.setContentLength(blob.getContent().length);

        return new ResponseEntity<>(blob.getContent(), headers, HttpStatus.OK);
    }

    // ================================================================
    // GET /vault/{vaultId}/verify
    // ================================================================

    @GetMapping("/vault/{vaultId}/verify")
    public ResponseEntity<?> verify(@PathVariable String vaultId,
            @RequestParam(value = "filename", required = false) String filename) {
        VaultOutcome<VerificationReport> outcome = verificationService.verify(vaultId, filename);
        if (!outcome.isSuccess()) {
            return failure(outcome);
        }
        return ResponseEntity.ok(VerifyResponse.from(outcome.getValue()));
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private ResponseEntity<Map<String, Object>> failure(VaultOutcome<?> outcome) {
        ErrorKind kind = outcome.getErrorKind();
        return switch (kind) {
            case VALIDATION -> errorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", outcome.getMessage());
            case NOT_FOUND -> errorResponse(HttpStatus.NOT_FOUND, "NOT_FOUND", outcome.getMessage());
            case PAYLOAD_TOO_LARGE -> errorResponse(HttpStatus.PAYLOAD_TOO_LARGE, "PAYLOAD_TOO_LARGE",
                    outcome.getMessage());
            case STORAGE -> errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", outcome.getMessage());
            case INTERNAL -> errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                    "An unexpected error occurred");
        };
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
