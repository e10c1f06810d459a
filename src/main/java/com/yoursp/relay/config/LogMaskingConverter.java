package com.yoursp.relay.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks object-store credentials in log messages.
 * <ul>
 * <li>access keys: first 4 chars + "..."</li>
 * <li>secret keys: "[REDACTED]"</li>
 * <li>presigned {@code X-Amz-Credential} / {@code X-Amz-Signature} values: "[REDACTED]"</li>
 * <li>AWS SigV4 and Bearer {@code Authorization} headers: scheme only</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.relay.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // secret-key=..., secretKey: ..., "aws_secret_access_key":"..."
    private static final Pattern SECRET_KEY_PATTERN = Pattern.compile(
            "((?:secret[-_]?key|aws_secret_access_key)[\"']?\\s*[=:]\\s*[\"']?)[^\"'&\\s,]+",
            Pattern.CASE_INSENSITIVE);

    // access-key=..., accessKey: ..., "aws_access_key_id":"..."
    private static final Pattern ACCESS_KEY_PATTERN = Pattern.compile(
            "((?:access[-_]?key|aws_access_key_id)[\"']?\\s*[=:]\\s*[\"']?)([A-Za-z0-9]{4})[A-Za-z0-9/+=]*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern AMZ_QUERY_PATTERN = Pattern
            .compile("(X-Amz-(?:Credential|Signature)=)[^&\\s\"]+");

    private static final Pattern SIGV4_PATTERN = Pattern
            .compile("(AWS4-HMAC-SHA256\\s+)[^\\r\\n\"]+");

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = SECRET_KEY_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = ACCESS_KEY_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = AMZ_QUERY_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = SIGV4_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");

        return masked;
    }
}
