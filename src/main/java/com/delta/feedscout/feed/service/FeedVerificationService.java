package com.delta.feedscout.feed.service;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.model.FetchOutcome;
import com.delta.feedscout.feed.model.ProbeFailureReason;
import com.delta.feedscout.feed.model.RunStatistics;
import com.delta.feedscout.feed.model.VerificationRunResult;
import com.delta.feedscout.feed.probe.FeedProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes a set of candidate URLs on a fixed-size worker pool and collects the
 * titles of every valid feed.
 *
 * <p>Each worker hands its probe to a separate runner thread and waits at most
 * the per-task timeout for it. A probe that overruns is interrupted and counted
 * as invalid, which frees the worker for the next queued URL. {@link #run}
 * returns only after every URL has resolved.
 *
 * <p>A probe that ignores interruption keeps its runner thread until it
 * returns on its own, so the number of threads doing network work can briefly
 * exceed the worker count. Such probes are counted and reported at the end of
 * the run.
 */
@Service
public class FeedVerificationService {
    private static final Logger log = LoggerFactory.getLogger(FeedVerificationService.class);
    private static final int PROGRESS_LOG_INTERVAL = 25;
    private static final long RUNAWAY_GRACE_MILLIS = 200;

    private final FeedProber feedProber;
    private final FeedScoutProperties properties;

    public FeedVerificationService(FeedProber feedProber, FeedScoutProperties properties) {
        this.feedProber = feedProber;
        this.properties = properties;
    }

    public VerificationRunResult run(Collection<String> urls) {
        FeedScoutProperties.Probe probe = properties.getProbe();
        return run(urls, probe.getWorkerCount(), probe.perTaskTimeout(), probe.getMaxTitles());
    }

    public VerificationRunResult run(Collection<String> urls, int workerCount, Duration perTaskTimeout, int maxTitles) {
        validate(urls, workerCount, perTaskTimeout, maxTitles);
        Set<String> candidates = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null) {
                candidates.add(url);
            }
        }

        Instant startedAt = Instant.now();
        FeedResultCollector collector = new FeedResultCollector();
        if (!candidates.isEmpty()) {
            dispatchAndAwait(candidates, workerCount, perTaskTimeout, maxTitles, collector);
        }

        Map<String, List<String>> feeds = collector.snapshot();
        RunStatistics statistics = new RunStatistics(candidates.size(), feeds.size());
        log.info("Total valid URLs: {}", statistics.valid());
        log.info("Total URLs processed: {}", statistics.total());
        log.info("Percentage of valid URLs: {}%", String.format(Locale.ROOT, "%.2f", statistics.validPercentage()));
        return new VerificationRunResult(feeds, statistics, startedAt, Instant.now());
    }

    private void dispatchAndAwait(
        Set<String> candidates,
        int workerCount,
        Duration perTaskTimeout,
        int maxTitles,
        FeedResultCollector collector
    ) {
        int total = candidates.size();
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, namedThreads("feed-worker-", false));
        // daemon so a probe that ignores interruption cannot keep the JVM alive
        ExecutorService probeRunner = Executors.newCachedThreadPool(namedThreads("feed-probe-", true));
        AtomicInteger probesRunning = new AtomicInteger();
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(total);
            for (String url : candidates) {
                futures.add(CompletableFuture
                    .supplyAsync(() -> probeWithinDeadline(probeRunner, probesRunning, url, perTaskTimeout, maxTitles), workers)
                    .exceptionally(error -> {
                        log.warn("Feed probe task failed for {}", url, error);
                        return FetchOutcome.invalid(url, ProbeFailureReason.UNEXPECTED_ERROR, String.valueOf(error));
                    })
                    .thenAccept(outcome -> {
                        int completed = collector.record(outcome);
                        if (outcome.isValid()) {
                            log.info("Valid RSS feed: {}", outcome.url());
                        }
                        if (completed % PROGRESS_LOG_INTERVAL == 0 || completed == total) {
                            log.info("Processed {}/{} URLs", completed, total);
                        }
                    }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            workers.shutdown();
            probeRunner.shutdownNow();
            reportRunawayProbes(probeRunner, probesRunning);
        }
    }

    private void reportRunawayProbes(ExecutorService probeRunner, AtomicInteger probesRunning) {
        if (probesRunning.get() == 0) {
            return;
        }
        try {
            probeRunner.awaitTermination(RUNAWAY_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int runaway = probesRunning.get();
        if (runaway > 0) {
            log.warn("{} probe(s) still running after their deadline and interruption", runaway);
        }
    }

    private FetchOutcome probeWithinDeadline(
        ExecutorService probeRunner,
        AtomicInteger probesRunning,
        String url,
        Duration timeout,
        int maxTitles
    ) {
        Future<FetchOutcome> future = probeRunner.submit(() -> {
            probesRunning.incrementAndGet();
            try {
                return feedProber.probe(url, timeout, maxTitles);
            } finally {
                probesRunning.decrementAndGet();
            }
        });
        try {
            FetchOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return FetchOutcome.invalid(url, ProbeFailureReason.UNEXPECTED_ERROR, "probe returned no outcome");
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Probe for {} exceeded {} ms", url, timeout.toMillis());
            return FetchOutcome.invalid(url, ProbeFailureReason.TIMEOUT, "task timeout " + timeout);
        } catch (ExecutionException e) {
            log.warn("Feed probe failed unexpectedly for {}", url, e.getCause());
            return FetchOutcome.invalid(url, ProbeFailureReason.UNEXPECTED_ERROR, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return FetchOutcome.invalid(url, ProbeFailureReason.UNEXPECTED_ERROR, "interrupted");
        }
    }

    private void validate(Collection<String> urls, int workerCount, Duration perTaskTimeout, int maxTitles) {
        if (urls == null) {
            throw new InvalidRunConfigurationException("urls must not be null");
        }
        if (workerCount < 1) {
            throw new InvalidRunConfigurationException("workerCount must be positive, got " + workerCount);
        }
        if (perTaskTimeout == null || perTaskTimeout.isZero() || perTaskTimeout.isNegative()) {
            throw new InvalidRunConfigurationException("perTaskTimeout must be positive, got " + perTaskTimeout);
        }
        if (maxTitles < 1) {
            throw new InvalidRunConfigurationException("maxTitles must be positive, got " + maxTitles);
        }
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
