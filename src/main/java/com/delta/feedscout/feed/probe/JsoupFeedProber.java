package com.delta.feedscout.feed.probe;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.http.FeedHttpClient;
import com.delta.feedscout.feed.model.FetchOutcome;
import com.delta.feedscout.feed.model.HttpFetchResult;
import com.delta.feedscout.feed.model.ProbeFailureReason;
import com.delta.feedscout.feed.text.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class JsoupFeedProber implements FeedProber {
    private static final Logger log = LoggerFactory.getLogger(JsoupFeedProber.class);
    private static final List<String> FEED_CONTENT_TYPE_MARKERS = List.of("xml", "rss");

    private final FeedHttpClient httpClient;
    private final FeedScoutProperties properties;

    public JsoupFeedProber(FeedHttpClient httpClient, FeedScoutProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public FetchOutcome probe(String url, Duration timeout, int maxTitles) {
        HttpFetchResult fetch = httpClient.get(url, FeedHttpClient.FEED_ACCEPT, timeout, properties.getMaxBodyBytes());
        if (!fetch.isSuccessful()) {
            return invalid(url, ProbeFailureReason.fromFetch(fetch), errorDetail(fetch));
        }
        if (!isFeedContentType(fetch.contentType())) {
            return invalid(url, ProbeFailureReason.NON_FEED_RESPONSE, "content_type=" + fetch.contentType());
        }

        List<String> rawTitles;
        try {
            rawTitles = FeedDocumentParser.parseEntryTitles(
                fetch.bodyBytes(),
                fetch.charsetName(),
                fetch.finalUrlOrRequested()
            );
        } catch (FeedParseException e) {
            return invalid(url, ProbeFailureReason.PARSE_FAILURE, e.getMessage());
        }

        List<String> titles = new ArrayList<>();
        for (String rawTitle : rawTitles) {
            if (titles.size() >= maxTitles) {
                break;
            }
            if (rawTitle == null || rawTitle.isBlank()) {
                continue;
            }
            titles.add(TitleNormalizer.normalize(rawTitle));
        }
        if (titles.isEmpty()) {
            return invalid(url, ProbeFailureReason.EMPTY_FEED, "entries=" + rawTitles.size());
        }
        log.debug("Extracted titles from {}: {}", url, titles);
        return FetchOutcome.valid(url, titles);
    }

    static boolean isFeedContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        for (String marker : FEED_CONTENT_TYPE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private FetchOutcome invalid(String url, ProbeFailureReason reason, String detail) {
        log.debug("Invalid feed {} reason={} detail={}", url, reason, detail);
        return FetchOutcome.invalid(url, reason, detail);
    }

    private String errorDetail(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode() + (fetch.errorMessage() == null ? "" : ": " + fetch.errorMessage());
        }
        return "http_" + fetch.statusCode();
    }
}
