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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestServiceTest {

    @Mock
    private BlobStore blobStore;

    @Mock
    private VaultAuditLog auditLog;

    private final ContentHasher contentHasher = new ContentHasher();
    private RelayProperties properties;
    private IngestService ingestService;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        ingestService = new IngestService(blobStore, auditLog, contentHasher, properties);
    }

    @Test
    @DisplayName("Success → blob stored under fresh ID, success record appended")
    void ingestStoresAndRecords() {
        byte[] content = "hello12345".getBytes(StandardCharsets.UTF_8);
        when(blobStore.put(anyString(), eq("note.txt"), eq(content))).thenReturn(BlobOutcome.ok(null));

        VaultOutcome<VaultEntry> outcome = ingestService.ingest("note.txt", content);

        assertTrue(outcome.isSuccess());
        VaultEntry entry = outcome.getValue();
        assertTrue(VaultIds.isValid(entry.getVaultId()));
        assertEquals("note.txt", entry.getFilename());
        assertEquals(contentHasher.digest(content), entry.getContentDigest());
        assertEquals(10L, entry.getSize());
        verify(blobStore).put(entry.getVaultId(), "note.txt", content);
        verify(auditLog).log(AuditOperation.INGEST, "note.txt", entry.getContentDigest(), entry.getVaultId(),
                AuditStatus.SUCCESS, null, 10L);
    }

    @Test
    @DisplayName("Storage failure → failed record + STORAGE outcome")
    void storageFailureRecordedAsFailed() {
        when(blobStore.put(anyString(), anyString(), any())).thenReturn(BlobOutcome.storageError("down"));

        VaultOutcome<VaultEntry> outcome = ingestService.ingest("note.txt", new byte[] { 1, 2 });

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.STORAGE, outcome.getErrorKind());
        assertFalse(outcome.getMessage().contains("down"));
        verify(auditLog).log(eq(AuditOperation.INGEST), eq("note.txt"), anyString(), anyString(),
                eq(AuditStatus.FAILED), eq("Upload to blob store failed"), eq(2L));
        verify(auditLog, never()).log(any(), any(), any(), any(), eq(AuditStatus.SUCCESS), any(), any());
    }

    @Test
    @DisplayName("Same filename twice → two distinct vault IDs")
    void collidingFilenamesGetDistinctIds() {
        when(blobStore.put(anyString(), anyString(), any())).thenReturn(BlobOutcome.ok(null));

        String first = ingestService.ingest("same.txt", new byte[] { 1 }).getValue().getVaultId();
        String second = ingestService.ingest("same.txt", new byte[] { 2 }).getValue().getVaultId();

        assertNotEquals(first, second);
    }

    @Test
    void filenameIsSanitizedBeforeStoring() {
        when(blobStore.put(anyString(), eq("etc_passwd"), any())).thenReturn(BlobOutcome.ok(null));

        VaultOutcome<VaultEntry> outcome = ingestService.ingest("../../etc/passwd", new byte[] { 1 });

        assertEquals("etc_passwd", outcome.getValue().getFilename());
    }

    @Test
    void unusableFilenameRejected() {
        VaultOutcome<VaultEntry> outcome = ingestService.ingest("../..", new byte[] { 1 });

        assertEquals(ErrorKind.VALIDATION, outcome.getErrorKind());
        verifyNoInteractions(blobStore, auditLog);
    }

    @Test
    void missingContentRejected() {
        assertEquals(ErrorKind.VALIDATION, ingestService.ingest("a.txt", null).getErrorKind());
        verifyNoInteractions(blobStore, auditLog);
    }

    @Test
    void oversizedPayloadRejected() {
        properties.setMaxUploadBytes(4);

        VaultOutcome<VaultEntry> outcome = ingestService.ingest("a.txt", new byte[5]);

        assertEquals(ErrorKind.PAYLOAD_TOO_LARGE, outcome.getErrorKind());
        verifyNoInteractions(blobStore, auditLog);
    }

    @Test
    void emptyFileIsAccepted() {
        when(blobStore.put(anyString(), anyString(), any())).thenReturn(BlobOutcome.ok(null));

        VaultOutcome<VaultEntry> outcome = ingestService.ingest("empty.txt", new byte[0]);

        assertTrue(outcome.isSuccess());
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                outcome.getValue().getContentDigest());
    }
}
