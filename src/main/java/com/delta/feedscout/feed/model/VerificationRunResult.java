package com.delta.feedscout.feed.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record VerificationRunResult(
    Map<String, List<String>> feeds,
    RunStatistics statistics,
    Instant startedAt,
    Instant finishedAt
) {}
