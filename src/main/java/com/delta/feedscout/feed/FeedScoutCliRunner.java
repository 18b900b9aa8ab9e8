package com.delta.feedscout.feed;

import com.delta.feedscout.config.FeedScoutProperties;
import com.delta.feedscout.feed.audit.ResultSanityAuditor;
import com.delta.feedscout.feed.model.AuditFinding;
import com.delta.feedscout.feed.model.VerificationRunResult;
import com.delta.feedscout.feed.output.ResultJsonWriter;
import com.delta.feedscout.feed.service.FeedVerificationService;
import com.delta.feedscout.feed.source.FeedSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

@Component
public class FeedScoutCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FeedScoutCliRunner.class);

    private final FeedScoutProperties properties;
    private final FeedSourceLoader sourceLoader;
    private final FeedVerificationService verificationService;
    private final ResultJsonWriter resultWriter;
    private final ResultSanityAuditor auditor;
    private final ConfigurableApplicationContext applicationContext;

    public FeedScoutCliRunner(
        FeedScoutProperties properties,
        FeedSourceLoader sourceLoader,
        FeedVerificationService verificationService,
        ResultJsonWriter resultWriter,
        ResultSanityAuditor auditor,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.sourceLoader = sourceLoader;
        this.verificationService = verificationService;
        this.resultWriter = resultWriter;
        this.auditor = auditor;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        Set<String> urls = sourceLoader.loadCandidateUrls(properties.getSource().getLocation());
        VerificationRunResult result = verificationService.run(urls);
        resultWriter.write(result.feeds(), Path.of(properties.getOutput().getPath()));

        List<AuditFinding> findings = auditor.audit(result.feeds());
        for (AuditFinding finding : findings) {
            switch (finding.type()) {
                case EMPTY_TITLES -> log.warn("Empty titles found for URL: {}", finding.url());
                case SHORT_TITLE -> log.warn("Title length issue for URL: {}, Title: {}", finding.url(), finding.title());
                case SPARSE_FEED -> log.warn(
                    "Less than {} titles found for URL: {}, Titles: {}",
                    properties.getAudit().getSparseFeedThreshold(),
                    finding.url(),
                    finding.titles()
                );
            }
        }
        log.info(
            "Feed run finished: total={} valid={} invalid={} findings={} in {}",
            result.statistics().total(),
            result.statistics().valid(),
            result.statistics().invalid(),
            findings.size(),
            Duration.between(result.startedAt(), result.finishedAt())
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
