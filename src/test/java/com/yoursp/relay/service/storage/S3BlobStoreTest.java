package com.yoursp.relay.service.storage;

import com.yoursp.relay.config.RelayProperties;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.ErrorResponse;
import okhttp3.Headers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class S3BlobStoreTest {

    private static final String VAULT_ID = "0b3c9a52-6f0e-4b0a-9c1d-2f4e5a6b7c8d";

    @Mock
    private MinioClient minioClient;

    private S3BlobStore blobStore;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.getStorage().setBucket("test-bucket");
        properties.getStorage().setKeyPrefix("vault");
        blobStore = new S3BlobStore(minioClient, properties);
    }

    @Test
    @DisplayName("put writes to {prefix}/{vaultId}/{filename} in the configured bucket")
    void putUsesCompositeKey() throws Exception {
        BlobOutcome<Void> outcome = blobStore.put(VAULT_ID, "note.txt", "hello".getBytes());

        assertTrue(outcome.isOk());
        ArgumentCaptor<PutObjectArgs> captor = ArgumentCaptor.forClass(PutObjectArgs.class);
        verify(minioClient).putObject(captor.capture());
        assertEquals("test-bucket", captor.getValue().bucket());
        assertEquals("vault/" + VAULT_ID + "/note.txt", captor.getValue().object());
    }

    @Test
    @DisplayName("put failure → storage outcome, no exception")
    void putFailureIsStorageError() throws Exception {
        when(minioClient.putObject(any(PutObjectArgs.class))).thenThrow(new ConnectException("refused"));

        BlobOutcome<Void> outcome = blobStore.put(VAULT_ID, "note.txt", new byte[] { 1 });

        assertEquals(BlobOutcome.Failure.STORAGE, outcome.getFailure());
    }

    @Test
    void getReturnsBytes() throws Exception {
        byte[] data = "hello12345".getBytes();
        GetObjectResponse response = new GetObjectResponse(Headers.of(), "test-bucket", "nyc3",
                "vault/" + VAULT_ID + "/note.txt", new ByteArrayInputStream(data));
        when(minioClient.getObject(any(GetObjectArgs.class))).thenReturn(response);

        BlobOutcome<byte[]> outcome = blobStore.get(VAULT_ID, "note.txt");

        assertTrue(outcome.isOk());
        assertArrayEquals(data, outcome.getValue());
    }

    @Test
    @DisplayName("NoSuchKey → NOT_FOUND")
    void getMissingIsNotFound() throws Exception {
        ErrorResponseException missing = errorResponse("NoSuchKey");
        when(minioClient.getObject(any(GetObjectArgs.class))).thenThrow(missing);

        BlobOutcome<byte[]> outcome = blobStore.get(VAULT_ID, "gone.txt");

        assertTrue(outcome.isNotFound());
    }

    @Test
    @DisplayName("Other S3 error codes → STORAGE")
    void getAccessDeniedIsStorageError() throws Exception {
        ErrorResponseException denied = errorResponse("AccessDenied");
        when(minioClient.getObject(any(GetObjectArgs.class))).thenThrow(denied);

        BlobOutcome<byte[]> outcome = blobStore.get(VAULT_ID, "note.txt");

        assertEquals(BlobOutcome.Failure.STORAGE, outcome.getFailure());
    }

    @Test
    void getTransportFailureIsStorageError() throws Exception {
        when(minioClient.getObject(any(GetObjectArgs.class))).thenThrow(new RuntimeException("timeout"));

        assertEquals(BlobOutcome.Failure.STORAGE, blobStore.get(VAULT_ID, "note.txt").getFailure());
    }

    @Test
    void reachableWhenBucketExists() throws Exception {
        when(minioClient.bucketExists(any(BucketExistsArgs.class))).thenReturn(true);
        assertTrue(blobStore.isReachable());
    }

    @Test
    void unreachableWhenBucketMissingOrProbeFails() throws Exception {
        when(minioClient.bucketExists(any(BucketExistsArgs.class)))
                .thenReturn(false)
                .thenThrow(new ConnectException("refused"));

        assertFalse(blobStore.isReachable());
        assertFalse(blobStore.isReachable());
    }

    @Test
    void blankPrefixLeavesBareKey() {
        RelayProperties properties = new RelayProperties();
        properties.getStorage().setKeyPrefix("");
        S3BlobStore store = new S3BlobStore(minioClient, properties);

        assertEquals(VAULT_ID + "/a.txt", store.objectKey(VAULT_ID, "a.txt"));
    }

    private static ErrorResponseException errorResponse(String code) {
        ErrorResponse errorResponse = mock(ErrorResponse.class);
        when(errorResponse.code()).thenReturn(code);
        ErrorResponseException ex = mock(ErrorResponseException.class);
        when(ex.errorResponse()).thenReturn(errorResponse);
        return ex;
    }
}
