package com.delta.feedscout.feed.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Canonical name of the charset named by the {@code charset=} parameter of the
     * content type, or {@code null} when the header names none or one the JVM does not support.
     */
    public String charsetName() {
        if (contentType == null) {
            return null;
        }
        for (String parameter : contentType.split(";")) {
            String trimmed = parameter.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                continue;
            }
            String value = trimmed.substring("charset=".length()).trim().replace("\"", "").replace("'", "");
            try {
                return value.isEmpty() || !Charset.isSupported(value) ? null : Charset.forName(value).name();
            } catch (IllegalCharsetNameException e) {
                return null;
            }
        }
        return null;
    }
}
