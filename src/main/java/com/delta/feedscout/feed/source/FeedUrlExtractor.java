package com.delta.feedscout.feed.source;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FeedUrlExtractor {
    private static final Pattern HTTP_URL = Pattern.compile("https?://[^\\s]+");

    private FeedUrlExtractor() {
    }

    /**
     * Collects every http(s) URL in {@code text}, de-duplicated and in order of
     * first appearance.
     */
    public static Set<String> extractUrls(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = HTTP_URL.matcher(text);
        while (matcher.find()) {
            urls.add(matcher.group());
        }
        return Collections.unmodifiableSet(urls);
    }
}
