package com.delta.feedscout.feed.model;

import java.util.List;

/**
 * Terminal result of probing one candidate URL. Valid outcomes always carry at
 * least one title; invalid outcomes carry none.
 */
public record FetchOutcome(
    String url,
    List<String> titles,
    ProbeFailureReason failureReason,
    String detail
) {
    public FetchOutcome {
        titles = titles == null ? List.of() : List.copyOf(titles);
    }

    public static FetchOutcome valid(String url, List<String> titles) {
        if (titles == null || titles.isEmpty()) {
            return invalid(url, ProbeFailureReason.EMPTY_FEED, "no usable titles");
        }
        return new FetchOutcome(url, titles, null, null);
    }

    public static FetchOutcome invalid(String url, ProbeFailureReason reason, String detail) {
        return new FetchOutcome(url, List.of(), reason == null ? ProbeFailureReason.UNEXPECTED_ERROR : reason, detail);
    }

    public boolean isValid() {
        return failureReason == null;
    }
}
