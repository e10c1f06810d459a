package com.yoursp.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code relay.*} YAML properties into a typed bean.
 * Passed into each component's constructor; nothing reads the environment directly.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    @NotBlank
    private String serviceName = "relay-vault";

    @NotBlank
    private String version = "1.0.0";

    /** Largest accepted upload, in bytes (default 100MB). */
    @Positive
    private long maxUploadBytes = 100L * 1024 * 1024;

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private Integrity integrity = new Integrity();

    public enum StorageType {
        S3, LOCAL
    }

    @Getter
    @Setter
    public static class Storage {

        @NotNull
        private StorageType type = StorageType.S3;

        private String endpoint = "https://nyc3.digitaloceanspaces.com";
        private String region = "nyc3";

        @NotBlank
        private String bucket = "relay-vault";

        private String accessKey;
        private String secretKey;

        /** Prepended to every object key: {@code {keyPrefix}/{vaultId}/{filename}}. */
        private String keyPrefix = "vault";

        /** Root directory for the local store. */
        private String localRoot = "/tmp/relay-vault";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);

        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Audit {

        @NotBlank
        private String vaultLog = "vault_log.jsonl";

        @NotBlank
        private String integrityLog = "integrity_checks.jsonl";
    }

    @Getter
    @Setter
    public static class Integrity {

        /** Integrity-check records kept after each run. */
        @Min(1)
        private int retention = 1000;
    }
}
