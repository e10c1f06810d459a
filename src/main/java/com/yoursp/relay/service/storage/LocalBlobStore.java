package com.yoursp.relay.service.storage;

import com.yoursp.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Local filesystem implementation of {@link BlobStore}.
 * Active with {@code relay.storage.type=local}; used for development and tests.
 * Saves blobs to {@code {localRoot}/{vaultId}/{filename}}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "relay.storage.type", havingValue = "local")
public class LocalBlobStore implements BlobStore {

    private final Path storageRoot;

    @Autowired
    public LocalBlobStore(RelayProperties properties) {
        this(Paths.get(properties.getStorage().getLocalRoot()));
    }

    public LocalBlobStore(Path storageRoot) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalBlobStore initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public BlobOutcome<Void> put(String vaultId, String filename, byte[] content) {
        try {
            Path filePath = resolve(vaultId, filename);
            Files.createDirectories(filePath.getParent());
            // readers never see a partially written blob
            Path tmp = Files.createTempFile(filePath.getParent(), ".upload-", ".tmp");
            try {
                Files.write(tmp, content);
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Stored {}/{} ({} bytes)", vaultId, filename, content.length);
            return BlobOutcome.ok(null);
        } catch (IOException | SecurityException e) {
            log.error("Failed to store {}/{}: {}", vaultId, filename, e.getMessage());
            return BlobOutcome.storageError("Write failed: " + vaultId + "/" + filename);
        }
    }

    @Override
    public BlobOutcome<byte[]> get(String vaultId, String filename) {
        try {
            Path filePath = resolve(vaultId, filename);
            byte[] bytes = Files.readAllBytes(filePath);
            log.debug("Read {}/{} ({} bytes)", vaultId, filename, bytes.length);
            return BlobOutcome.ok(bytes);
        } catch (NoSuchFileException e) {
            log.warn("Blob not found: {}/{}", vaultId, filename);
            return BlobOutcome.notFound(vaultId + "/" + filename);
        } catch (IOException | SecurityException e) {
            log.error("Failed to read {}/{}: {}", vaultId, filename, e.getMessage());
            return BlobOutcome.storageError("Read failed: " + vaultId + "/" + filename);
        }
    }

    @Override
    public boolean isReachable() {
        return Files.isDirectory(storageRoot) && Files.isWritable(storageRoot);
    }

    private Path resolve(String vaultId, String filename) {
        // a blob must sit directly in its own vault directory, one level below the root
        Path vaultDir = storageRoot.resolve(vaultId).normalize();
        Path resolved = vaultDir.resolve(filename).normalize();
        if (!storageRoot.equals(vaultDir.getParent()) || !vaultDir.equals(resolved.getParent())) {
            throw new SecurityException("Path traversal attempt detected: " + vaultId + "/" + filename);
        }
        return resolved;
    }
}
