package com.yoursp.relay.service.storage;

/**
 * Abstraction for the object store holding vault blobs.
 * Objects are addressed by {@code vaultId/filename}.
 * Implementations can target S3-compatible services or the local FS.
 */
public interface BlobStore {

    /**
     * Store a blob with private access.
     *
     * @param vaultId  identifier generated at ingest
     * @param filename sanitized original filename
     * @param content  raw bytes
     * @return ok, or a storage failure
     */
    BlobOutcome<Void> put(String vaultId, String filename, byte[] content);

    /**
     * Read a blob back.
     *
     * @return the bytes, {@code NOT_FOUND} when the object is absent, or a
     *         storage failure
     */
    BlobOutcome<byte[]> get(String vaultId, String filename);

    /**
     * Lightweight reachability probe run before batch work.
     */
    boolean isReachable();
}
