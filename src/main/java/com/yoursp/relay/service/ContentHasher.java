package com.yoursp.relay.service;

import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content digests, rendered as 64 lowercase hex characters.
 */
@Component
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public String digest(byte[] content) {
        try {
            return HEX_FORMAT.formatHex(MessageDigest.getInstance(ALGORITHM).digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Whether {@code content} still hashes to {@code recordedDigest}.
     */
    public boolean matches(byte[] content, String recordedDigest) {
        return recordedDigest != null && digest(content).equalsIgnoreCase(recordedDigest);
    }
}
