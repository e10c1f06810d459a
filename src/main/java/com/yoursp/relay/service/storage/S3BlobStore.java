package com.yoursp.relay.service.storage;

import com.yoursp.relay.config.RelayProperties;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.ErrorResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Map;

/**
 * S3-compatible {@link BlobStore} (DigitalOcean Spaces, MinIO, AWS) on the
 * MinIO client. Keys are {@code {keyPrefix}/{vaultId}/{filename}} in a single
 * bucket. Active unless {@code relay.storage.type=local}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "relay.storage.type", havingValue = "s3", matchIfMissing = true)
public class S3BlobStore implements BlobStore {

    private static final String CONTENT_TYPE = "application/octet-stream";
    private static final Map<String, String> PRIVATE_ACL = Map.of("x-amz-acl", "private");

    private final MinioClient minioClient;
    private final String bucket;
    private final String keyPrefix;

    public S3BlobStore(MinioClient minioClient, RelayProperties properties) {
        this.minioClient = minioClient;
        this.bucket = properties.getStorage().getBucket();
        this.keyPrefix = properties.getStorage().getKeyPrefix();
    }

    @Override
    public BlobOutcome<Void> put(String vaultId, String filename, byte[] content) {
        String key = objectKey(vaultId, filename);
        try (InputStream is = new ByteArrayInputStream(content)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(is, content.length, -1)
                    .contentType(CONTENT_TYPE)
                    .headers(PRIVATE_ACL)
                    .build());
            log.debug("Uploaded {} ({} bytes)", key, content.length);
            return BlobOutcome.ok(null);
        } catch (Exception e) {
            log.error("Failed to upload {} to bucket {}: {}", key, bucket, e.getMessage());
            return BlobOutcome.storageError("Upload failed: " + key);
        }
    }

    @Override
    public BlobOutcome<byte[]> get(String vaultId, String filename) {
        String key = objectKey(vaultId, filename);
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder().bucket(bucket).object(key).build())) {
            byte[] bytes = response.readAllBytes();
            log.debug("Downloaded {} ({} bytes)", key, bytes.length);
            return BlobOutcome.ok(bytes);
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                log.warn("Object not found: {}", key);
                return BlobOutcome.notFound(key);
            }
            log.error("Failed to download {}: {}", key, e.getMessage());
            return BlobOutcome.storageError("Download failed: " + key);
        } catch (Exception e) {
            log.error("Failed to download {}: {}", key, e.getMessage());
            return BlobOutcome.storageError("Download failed: " + key);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!exists) {
                log.error("Bucket '{}' does not exist", bucket);
            }
            return exists;
        } catch (Exception e) {
            log.error("Object store connectivity check failed for bucket '{}': {}", bucket, e.getMessage());
            return false;
        }
    }

    String objectKey(String vaultId, String filename) {
        String key = vaultId + "/" + filename;
        return StringUtils.hasText(keyPrefix) ? keyPrefix + "/" + key : key;
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse() != null ? e.errorResponse().code() : null;
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code) || "NoSuchObject".equals(code);
    }
}
