package com.delta.feedscout.feed.service;

import com.delta.feedscout.feed.model.FetchOutcome;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe sink for probe outcomes of a single run. Every URL may resolve
 * exactly once; only valid outcomes land in the feed mapping.
 */
class FeedResultCollector {
    private final Map<String, List<String>> feeds = new ConcurrentHashMap<>();
    private final Set<String> resolved = ConcurrentHashMap.newKeySet();
    private final AtomicInteger completed = new AtomicInteger();

    int record(FetchOutcome outcome) {
        if (!resolved.add(outcome.url())) {
            throw new IllegalStateException("URL resolved more than once: " + outcome.url());
        }
        if (outcome.isValid()) {
            feeds.put(outcome.url(), outcome.titles());
        }
        return completed.incrementAndGet();
    }

    Map<String, List<String>> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(feeds));
    }
}
