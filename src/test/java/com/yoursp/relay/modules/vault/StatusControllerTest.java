package com.yoursp.relay.modules.vault;

import com.yoursp.relay.config.RelayProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusControllerTest {

    @Test
    void reportsOperationalWithConfiguredIdentity() {
        RelayProperties properties = new RelayProperties();
        properties.setServiceName("relay-test");
        properties.setVersion("9.9.9");

        Map<String, Object> body = new StatusController(properties).status();

        assertEquals("operational", body.get("status"));
        assertEquals("relay-test", body.get("service"));
        assertEquals("9.9.9", body.get("version"));
        assertNotNull(body.get("timestamp"));
    }
}
