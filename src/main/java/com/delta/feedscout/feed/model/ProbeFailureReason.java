package com.delta.feedscout.feed.model;

import java.util.Locale;

/**
 * Debug-level detail behind an invalid outcome. Callers only ever branch on
 * {@link FetchOutcome#isValid()}.
 */
public enum ProbeFailureReason {
    NETWORK_FAILURE,
    TIMEOUT,
    HTTP_STATUS,
    NON_FEED_RESPONSE,
    PARSE_FAILURE,
    EMPTY_FEED,
    UNEXPECTED_ERROR;

    public static ProbeFailureReason fromFetch(HttpFetchResult fetch) {
        if (fetch == null) {
            return UNEXPECTED_ERROR;
        }
        String errorCode = fetch.errorCode();
        if (errorCode == null || errorCode.isBlank()) {
            return HTTP_STATUS;
        }
        String code = errorCode.toLowerCase(Locale.ROOT);
        if (code.contains("timeout")) {
            return TIMEOUT;
        }
        if (code.equals("body_too_large")) {
            return NON_FEED_RESPONSE;
        }
        return NETWORK_FAILURE;
    }
}
