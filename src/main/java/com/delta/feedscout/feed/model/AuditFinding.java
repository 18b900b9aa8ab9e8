package com.delta.feedscout.feed.model;

import java.util.List;

public record AuditFinding(
    FindingType type,
    String url,
    String title,
    List<String> titles
) {
    public static AuditFinding emptyTitles(String url) {
        return new AuditFinding(FindingType.EMPTY_TITLES, url, null, List.of());
    }

    public static AuditFinding shortTitle(String url, String title) {
        return new AuditFinding(FindingType.SHORT_TITLE, url, title, List.of());
    }

    public static AuditFinding sparseFeed(String url, List<String> titles) {
        return new AuditFinding(FindingType.SPARSE_FEED, url, null, List.copyOf(titles));
    }
}
