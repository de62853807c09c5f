package com.golfdata.clubtracker.config;

import com.golfdata.clubtracker.crawl.model.UnknownTermPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT = "club-tracker/0.1 (+catalog-refresh)";

    private int activeRunMinutes = 120;
    private int staleRunMinutes = 240;
    private Fetch fetch = new Fetch();
    private Crawl crawl = new Crawl();
    private Refresh refresh = new Refresh();
    private Reconciliation reconciliation = new Reconciliation();
    private Cli cli = new Cli();
    private Map<String, Source> sources = new LinkedHashMap<>();

    public int getActiveRunMinutes() {
        return Math.max(1, activeRunMinutes);
    }

    public void setActiveRunMinutes(int activeRunMinutes) {
        this.activeRunMinutes = Math.max(1, activeRunMinutes);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public void setRefresh(Refresh refresh) {
        this.refresh = refresh;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Source source(String key) {
        if (key == null) {
            return new Source();
        }
        Source source = sources.get(key.trim().toLowerCase(Locale.ROOT));
        return source == null ? new Source() : source;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Fetch {
        private int requestTimeoutSeconds = 30;
        private int requestsPerWindow = 30;
        private long rateWindowMs = 60_000;
        private int postRequestDelayMs = 2000;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 4000;
        private int retryMaxDelayMs = 10_000;
        private int httpThreads = 4;
        private List<String> userAgents = new ArrayList<>();

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestsPerWindow() {
            return Math.max(1, requestsPerWindow);
        }

        public void setRequestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = Math.max(1, requestsPerWindow);
        }

        public long getRateWindowMs() {
            return Math.max(1, rateWindowMs);
        }

        public void setRateWindowMs(long rateWindowMs) {
            this.rateWindowMs = Math.max(1, rateWindowMs);
        }

        public int getPostRequestDelayMs() {
            return Math.max(0, postRequestDelayMs);
        }

        public void setPostRequestDelayMs(int postRequestDelayMs) {
            this.postRequestDelayMs = Math.max(0, postRequestDelayMs);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getHttpThreads() {
            return Math.max(1, httpThreads);
        }

        public void setHttpThreads(int httpThreads) {
            this.httpThreads = Math.max(1, httpThreads);
        }

        public List<String> getUserAgents() {
            List<String> normalized = new ArrayList<>();
            for (String agent : userAgents) {
                if (agent != null && !agent.isBlank()) {
                    normalized.add(agent.trim());
                }
            }
            if (normalized.isEmpty()) {
                normalized.add(DEFAULT_USER_AGENT);
            }
            return normalized;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
        }
    }

    public static class Crawl {
        private int maxPagesPerCategory = 10;
        private boolean enrichDetails = false;

        public int getMaxPagesPerCategory() {
            return Math.max(1, maxPagesPerCategory);
        }

        public void setMaxPagesPerCategory(int maxPagesPerCategory) {
            this.maxPagesPerCategory = Math.max(1, maxPagesPerCategory);
        }

        public boolean isEnrichDetails() {
            return enrichDetails;
        }

        public void setEnrichDetails(boolean enrichDetails) {
            this.enrichDetails = enrichDetails;
        }
    }

    public static class Refresh {
        private int intervalHours = 24;
        private int batchSize = 100;

        public int getIntervalHours() {
            return Math.max(1, intervalHours);
        }

        public void setIntervalHours(int intervalHours) {
            this.intervalHours = Math.max(1, intervalHours);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }
    }

    public static class Reconciliation {
        private UnknownTermPolicy unknownBrandPolicy = UnknownTermPolicy.CREATE;
        private UnknownTermPolicy unknownClubTypePolicy = UnknownTermPolicy.CREATE;

        public UnknownTermPolicy getUnknownBrandPolicy() {
            return unknownBrandPolicy == null ? UnknownTermPolicy.CREATE : unknownBrandPolicy;
        }

        public void setUnknownBrandPolicy(UnknownTermPolicy unknownBrandPolicy) {
            this.unknownBrandPolicy = unknownBrandPolicy;
        }

        public UnknownTermPolicy getUnknownClubTypePolicy() {
            return unknownClubTypePolicy == null ? UnknownTermPolicy.CREATE : unknownClubTypePolicy;
        }

        public void setUnknownClubTypePolicy(UnknownTermPolicy unknownClubTypePolicy) {
            this.unknownClubTypePolicy = unknownClubTypePolicy;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String mode = "full";
        private String source = "all";
        private String category;
        private String brand;
        private Integer batchSize;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode == null || mode.isBlank() ? "full" : mode.trim().toLowerCase(Locale.ROOT);
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getSource() {
            return source == null || source.isBlank() ? "all" : source.trim().toLowerCase(Locale.ROOT);
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getCategory() {
            return category == null || category.isBlank() ? null : category.trim();
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getBrand() {
            return brand == null || brand.isBlank() ? null : brand.trim();
        }

        public void setBrand(String brand) {
            this.brand = brand;
        }

        public Integer getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(Integer batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String baseUrl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl == null || baseUrl.isBlank() ? null : baseUrl.trim();
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
