package com.yoursp.relay.modules.vault;

import com.yoursp.relay.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final RelayProperties properties;

    @GetMapping("/")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "operational");
        body.put("service", properties.getServiceName());
        body.put("version", properties.getVersion());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
