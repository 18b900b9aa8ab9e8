package com.delta.feedscout.feed.http;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound GET client shared by all probes. Every failure is reported through
 * {@link HttpFetchResult#errorCode()} instead of an exception, and a single
 * attempt is made per call. The timeout covers the whole exchange, body
 * included.
 */
@Service
public class FeedHttpClient {
    private static final Logger log = LoggerFactory.getLogger(FeedHttpClient.class);
    public static final String FEED_ACCEPT =
        "application/rss+xml,application/atom+xml,application/xml;q=0.9,text/xml;q=0.9,*/*;q=0.1";

    private final FeedScoutProperties properties;
    private final HttpClient client;

    public FeedHttpClient(FeedScoutProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Duration.ofSeconds(properties.getRequestTimeoutSeconds()), properties.getMaxBodyBytes());
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout, int maxBytes) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        Duration safeTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
            : timeout;
        int limit = Math.max(1, Math.min(maxBytes, FeedScoutProperties.MAX_BODY_BYTES_CEILING));
        long deadlineNanos = System.nanoTime() + safeTimeout.toNanos();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(safeTimeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();

        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            byte[] bodyBytes;
            try (InputStream body = response.body()) {
                bodyBytes = readBody(body, limit, deadlineNanos, safeTimeout);
            }
            if (bodyBytes.length > limit) {
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    response.headers().firstValue("Content-Type").orElse(null),
                    Instant.now(),
                    Duration.between(startedAt, Instant.now()),
                    "body_too_large",
                    "Response exceeded " + limit + " bytes"
                );
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bodyBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    // Closing the stream at the deadline unblocks a reader stuck on a trickling body.
    private byte[] readBody(InputStream body, int limit, long deadlineNanos, Duration timeout) throws IOException {
        long remainingNanos = deadlineNanos - System.nanoTime();
        if (remainingNanos <= 0) {
            throw new HttpTimeoutException("response body not read within " + timeout);
        }
        AtomicBoolean expired = new AtomicBoolean();
        CompletableFuture<Void> watchdog = CompletableFuture.runAsync(
            () -> {
                expired.set(true);
                closeExpired(body);
            },
            CompletableFuture.delayedExecutor(remainingNanos, TimeUnit.NANOSECONDS)
        );
        byte[] bytes = null;
        try {
            bytes = body.readNBytes(limit + 1);
        } catch (IOException e) {
            if (!expired.get()) {
                throw e;
            }
        } finally {
            watchdog.cancel(false);
        }
        if (expired.get()) {
            throw new HttpTimeoutException("response body not read within " + timeout);
        }
        return bytes;
    }

    private void closeExpired(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Closing expired response body failed: {}", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
