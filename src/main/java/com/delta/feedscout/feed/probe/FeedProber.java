package com.delta.feedscout.feed.probe;

import com.delta.feedscout.feed.model.FetchOutcome;

import java.time.Duration;

public interface FeedProber {
  /**
   * Fetches {@code url} once and decides whether it is a usable feed. Never
   * throws for network, HTTP or parse problems; those come back as invalid
   * outcomes.
   */
  FetchOutcome probe(String url, Duration timeout, int maxTitles);
}
