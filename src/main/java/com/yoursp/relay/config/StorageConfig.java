package com.yoursp.relay.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Builds the S3 client. Every call it makes is bounded by the configured
 * connect/read/write timeouts.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "relay.storage.type", havingValue = "s3", matchIfMissing = true)
    public MinioClient minioClient(RelayProperties properties) {
        RelayProperties.Storage storage = properties.getStorage();
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(storage.getEndpoint())
                .region(storage.getRegion());
        if (StringUtils.hasText(storage.getAccessKey()) && StringUtils.hasText(storage.getSecretKey())) {
            builder.credentials(storage.getAccessKey(), storage.getSecretKey());
        } else {
            log.warn("No object-store credentials configured, using anonymous access");
        }
        MinioClient client = builder.build();
        client.setTimeout(
                storage.getConnectTimeout().toMillis(),
                storage.getWriteTimeout().toMillis(),
                storage.getReadTimeout().toMillis());

        log.info("S3 client configured: endpoint={}, region={}, bucket={}",
                storage.getEndpoint(), storage.getRegion(), storage.getBucket());
        return client;
    }
}
