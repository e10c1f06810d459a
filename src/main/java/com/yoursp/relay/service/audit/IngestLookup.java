package com.yoursp.relay.service.audit;

import com.yoursp.relay.model.AuditRecord;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the vault log: where original digests come from.
 * Backed by a linear scan today; callers do not depend on that.
 */
public interface IngestLookup {

    /**
     * First successful ingest record for {@code vaultId}.
     */
    Optional<AuditRecord> findIngestRecord(String vaultId);

    /**
     * First successful ingest record for {@code vaultId} stored under {@code filename}.
     */
    Optional<AuditRecord> findIngestRecord(String vaultId, String filename);

    /**
     * Every successful ingest in log order.
     *
     * @throws IOException if the log exists but cannot be read
     */
    List<AuditRecord> successfulIngests() throws IOException;
}
