package com.yoursp.relay.modules.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.relay.config.RelayProperties;
import com.yoursp.relay.service.audit.JsonLinesFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Append-only log of integrity check outcomes and run summaries,
 * kept separate from the vault log and pruned to a bounded tail.
 */
@Slf4j
@Component
public class IntegrityTrail {

    private final JsonLinesFile file;

    @Autowired
    public IntegrityTrail(RelayProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getAudit().getIntegrityLog()), objectMapper);
    }

    public IntegrityTrail(Path logFile, ObjectMapper objectMapper) {
        this.file = new JsonLinesFile(logFile, objectMapper);
    }

    public void record(Object entry) {
        try {
            file.append(entry);
        } catch (IOException e) {
            log.error("Failed to write integrity log {}: {}", file.getPath(), e.getMessage());
        }
    }

    /**
     * Drop the oldest lines until at most {@code keep} remain.
     *
     * @return lines dropped
     */
    public int prune(int keep) {
        try {
            int dropped = file.retainLast(keep);
            if (dropped > 0) {
                log.info("Cleaned up integrity log - dropped {} entries, kept last {}", dropped, keep);
            }
            return dropped;
        } catch (IOException e) {
            log.error("Failed to prune integrity log {}: {}", file.getPath(), e.getMessage());
            return 0;
        }
    }

    public List<JsonNode> entries() throws IOException {
        return file.readAll(JsonNode.class);
    }
}
