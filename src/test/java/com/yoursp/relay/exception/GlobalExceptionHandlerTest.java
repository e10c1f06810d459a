package com.yoursp.relay.exception;

import com.yoursp.relay.config.CorrelationIdFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void oversizedUploadIs413() {
        ResponseEntity<Map<String, Object>> result =
                handler.handleMaxUploadSize(new MaxUploadSizeExceededException(100));

        assertEquals(413, result.getStatusCode().value());
        assertEquals("PAYLOAD_TOO_LARGE", result.getBody().get("error"));
    }

    @Test
    void missingPartIs400() {
        ResponseEntity<Map<String, Object>> result =
                handler.handleMissingInput(new MissingServletRequestPartException("file"));

        assertEquals(400, result.getStatusCode().value());
        assertEquals("VALIDATION_FAILED", result.getBody().get("error"));
        assertEquals("No file provided", result.getBody().get("message"));
    }

    @Test
    void malformedMultipartIs400() {
        ResponseEntity<Map<String, Object>> result =
                handler.handleMultipart(new MultipartException("Current request is not a multipart request"));

        assertEquals(400, result.getStatusCode().value());
    }

    @Test
    void unexpectedErrorHidesDetailsAndCarriesCorrelationId() {
        MDC.put(CorrelationIdFilter.MDC_KEY, "corr-1");

        ResponseEntity<Map<String, Object>> result =
                handler.handleGenericException(new IllegalStateException("s3://secret-bucket/key exploded"));

        assertEquals(500, result.getStatusCode().value());
        Map<String, Object> body = result.getBody();
        assertEquals("INTERNAL_ERROR", body.get("error"));
        assertEquals("corr-1", body.get("correlationId"));
        assertFalse(body.get("message").toString().contains("secret-bucket"));
    }
}
