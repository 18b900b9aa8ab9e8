package com.delta.feedscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "feedscout")
public class FeedScoutProperties {
    public static final int MAX_BODY_BYTES_CEILING = 256 * 1024 * 1024;
    private static final String DEFAULT_USER_AGENT = "feed-scout/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 5;
    private int maxBodyBytes = 5_000_000;
    private Probe probe = new Probe();
    private Audit audit = new Audit();
    private Source source = new Source();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxBodyBytes() {
        return clampBodyBytes(maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = clampBodyBytes(maxBodyBytes);
    }

    private static int clampBodyBytes(int value) {
        return Math.min(MAX_BODY_BYTES_CEILING, Math.max(1024, value));
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Probe {
        private int workerCount = 10;
        private int perTaskTimeoutSeconds = 10;
        private int maxTitles = 5;

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPerTaskTimeoutSeconds() {
            return Math.max(1, perTaskTimeoutSeconds);
        }

        public void setPerTaskTimeoutSeconds(int perTaskTimeoutSeconds) {
            this.perTaskTimeoutSeconds = Math.max(1, perTaskTimeoutSeconds);
        }

        public Duration perTaskTimeout() {
            return Duration.ofSeconds(getPerTaskTimeoutSeconds());
        }

        public int getMaxTitles() {
            return Math.max(1, maxTitles);
        }

        public void setMaxTitles(int maxTitles) {
            this.maxTitles = Math.max(1, maxTitles);
        }
    }

    public static class Audit {
        private int shortTitleThreshold = 10;
        private int sparseFeedThreshold = 3;

        public int getShortTitleThreshold() {
            return Math.max(0, shortTitleThreshold);
        }

        public void setShortTitleThreshold(int shortTitleThreshold) {
            this.shortTitleThreshold = Math.max(0, shortTitleThreshold);
        }

        public int getSparseFeedThreshold() {
            return Math.max(0, sparseFeedThreshold);
        }

        public void setSparseFeedThreshold(int sparseFeedThreshold) {
            this.sparseFeedThreshold = Math.max(0, sparseFeedThreshold);
        }
    }

    public static class Source {
        private String location = "";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location == null ? "" : location.trim();
        }
    }

    public static class Output {
        private String path = "artifacts/rss_data.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
