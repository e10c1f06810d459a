package com.yoursp.relay;

import com.yoursp.relay.modules.integrity.IntegrityAuditor;
import com.yoursp.relay.service.storage.BlobStore;
import com.yoursp.relay.service.storage.LocalBlobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context wiring with the local blob store; no object store needed.
 */
@SpringBootTest(properties = {
        "relay.storage.type=local",
        "relay.storage.local-root=target/test-vault/blobs",
        "relay.audit.vault-log=target/test-vault/vault_log.jsonl",
        "relay.audit.integrity-log=target/test-vault/integrity_checks.jsonl"
})
class RelayApplicationTest {

    @Autowired
    private BlobStore blobStore;

    @Autowired
    private IntegrityAuditor auditor;

    @Test
    void contextLoadsWithLocalStore() {
        assertInstanceOf(LocalBlobStore.class, blobStore);
        assertTrue(blobStore.isReachable());
        assertNotNull(auditor);
    }
}
