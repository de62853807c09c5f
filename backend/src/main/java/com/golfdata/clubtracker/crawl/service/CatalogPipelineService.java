package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.model.FullCrawlRequest;
import com.golfdata.clubtracker.crawl.model.PipelineRunSummary;
import com.golfdata.clubtracker.crawl.model.RawListing;
import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.model.ScrapeType;
import com.golfdata.clubtracker.crawl.model.StaleProductSource;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import com.golfdata.clubtracker.crawl.source.CategoryCrawl;
import com.golfdata.clubtracker.crawl.source.SourceAdapter;
import com.golfdata.clubtracker.crawl.source.SourceAdapterRegistry;
import com.golfdata.clubtracker.crawl.source.SourceFetchException;
import com.golfdata.clubtracker.crawl.source.UnknownSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for both pipeline modes. Every invocation writes one scrape run and returns a
 * summary; failures inside a run are recorded on the run, never thrown to the caller.
 */
@Service
public class CatalogPipelineService {
    private static final Logger log = LoggerFactory.getLogger(CatalogPipelineService.class);

    private final SourceAdapterRegistry registry;
    private final ReconciliationService reconciliationService;
    private final StalenessScheduler stalenessScheduler;
    private final ScrapeRunLogger runLogger;
    private final CatalogJdbcRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    public CatalogPipelineService(
        SourceAdapterRegistry registry,
        ReconciliationService reconciliationService,
        StalenessScheduler stalenessScheduler,
        ScrapeRunLogger runLogger,
        CatalogJdbcRepository repository,
        PipelineProperties properties,
        Clock clock
    ) {
        this.registry = registry;
        this.reconciliationService = reconciliationService;
        this.stalenessScheduler = stalenessScheduler;
        this.runLogger = runLogger;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineRunSummary runFullCrawl(FullCrawlRequest request) {
        FullCrawlRequest effective = request == null ? FullCrawlRequest.of(null) : request;
        SourceAdapter adapter = resolveAdapter(effective.source());
        String category = effective.normalizedCategory();
        if (category != null) {
            if (!adapter.supportsCategory(category)) {
                throw new IllegalArgumentException(
                    "Unknown category for " + adapter.key() + ": " + category + " (known: " + adapter.categories() + ")"
                );
            }
            category = category.toLowerCase(Locale.ROOT);
        }
        boolean enrich = effective.enrichDetails() != null
            ? effective.enrichDetails()
            : properties.getCrawl().isEnrichDetails();
        String brandFilter = effective.normalizedBrandFilter();
        String scrapeType = ScrapeType.forCrawl(category);

        ensureNoActiveRun(adapter.sourceName());
        Instant startedAt = clock.instant();
        Long runId = openRun(adapter.sourceName(), scrapeType);
        if (runId == null) {
            return unrecordedRun(adapter.sourceName(), scrapeType, startedAt);
        }

        List<String> categories = category == null ? adapter.categories() : List.of(category);
        ReconciliationTally tally = new ReconciliationTally();
        int pagesFetched = 0;
        int pageErrors = 0;
        int skipped = 0;
        int detailErrors = 0;
        int runErrors = 0;
        String lastPageError = null;
        ScrapeRunStatus status;
        String errorMessage = null;
        try {
            for (String current : categories) {
                log.info("Crawling {} {} (brand={}, enrich={})", adapter.sourceName(), current, brandFilter, enrich);
                CategoryCrawl crawl = adapter.listCategory(current, 1, brandFilter);
                for (RawListing listing : crawl) {
                    RawListing toStore = listing;
                    if (enrich && listing.detailUrl() != null) {
                        try {
                            Optional<RawListing> detail = adapter.fetchDetail(listing.detailUrl());
                            if (detail.isPresent()) {
                                toStore = listing.withDetail(detail.get());
                            }
                        } catch (SourceFetchException e) {
                            detailErrors++;
                            log.warn("Skipping {} {}: {}", listing.brandText(), listing.modelText(), e.getMessage());
                            continue;
                        }
                    }
                    reconciliationService.reconcileInto(toStore, tally);
                }
                pagesFetched += crawl.pagesFetched();
                pageErrors += crawl.pageErrors();
                skipped += crawl.skippedItems();
                if (crawl.lastError() != null) {
                    lastPageError = current + ": " + crawl.lastError().describe();
                }
            }
            if (pagesFetched == 0 && pageErrors > 0) {
                status = ScrapeRunStatus.FAILED;
                errorMessage = "every category page unreachable; last " + lastPageError;
            } else {
                status = ScrapeRunStatus.SUCCESS;
                if (tally.errors() + pageErrors + detailErrors > 0) {
                    status = ScrapeRunStatus.PARTIAL;
                    errorMessage = firstNonNull(lastPageError, tally.lastError());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Full crawl of {} aborted", adapter.sourceName(), e);
            status = ScrapeRunStatus.FAILED;
            errorMessage = describe(e);
            runErrors = 1;
        }
        int errors = tally.errors() + pageErrors + detailErrors + runErrors;
        return closeRun(
            runId,
            adapter.sourceName(),
            scrapeType,
            status,
            tally.inserted(),
            tally.updated(),
            errors,
            skipped + tally.rejected(),
            errorMessage,
            startedAt
        );
    }

    public PipelineRunSummary runRefresh(String source, Integer maxBatch) {
        SourceAdapter adapter = resolveAdapter(source);
        String scrapeType = ScrapeType.UPDATE_PRICES;
        ensureNoActiveRun(adapter.sourceName());
        Instant startedAt = clock.instant();
        Long runId = openRun(adapter.sourceName(), scrapeType);
        if (runId == null) {
            return unrecordedRun(adapter.sourceName(), scrapeType, startedAt);
        }

        RefreshTally tally = null;
        ScrapeRunStatus status;
        String errorMessage = null;
        try {
            List<StaleProductSource> stale = stalenessScheduler.selectStale(adapter.sourceName(), maxBatch);
            log.info("Refreshing {} stale product sources from {}", stale.size(), adapter.sourceName());
            tally = stalenessScheduler.refresh(adapter, stale);
            status = ScrapeRunLogger.statusFor(tally.errors());
            errorMessage = tally.errors() > 0 ? tally.lastError() : null;
        } catch (RuntimeException e) {
            log.warn("Price refresh of {} aborted", adapter.sourceName(), e);
            status = ScrapeRunStatus.FAILED;
            errorMessage = describe(e);
        }
        return closeRun(
            runId,
            adapter.sourceName(),
            scrapeType,
            status,
            0,
            tally == null ? 0 : tally.updated(),
            tally == null ? 1 : tally.errors(),
            0,
            errorMessage,
            startedAt
        );
    }

    private SourceAdapter resolveAdapter(String source) {
        if (source == null || source.isBlank() || SourceAdapterRegistry.ALL.equalsIgnoreCase(source.trim())) {
            List<SourceAdapter> enabled = registry.enabled();
            if (enabled.isEmpty()) {
                throw new UnknownSourceException("No source adapter is enabled");
            }
            if (source != null && !source.isBlank() && enabled.size() > 1) {
                throw new UnknownSourceException("A single run needs one source, got 'all'");
            }
            return enabled.get(0);
        }
        return registry.get(source);
    }

    private void ensureNoActiveRun(String sourceName) {
        Instant activeCutoff = clock.instant().minus(Duration.ofMinutes(properties.getActiveRunMinutes()));
        for (ScrapeRun run : repository.findRunningScrapeRuns(sourceName)) {
            if (run.startedAt() != null && run.startedAt().isAfter(activeCutoff)) {
                throw new ActiveScrapeRunException(sourceName, run.id());
            }
        }
    }

    private Long openRun(String sourceName, String scrapeType) {
        try {
            return runLogger.open(sourceName, scrapeType);
        } catch (RuntimeException e) {
            log.warn("Could not record a scrape run for {} ({}), nothing crawled", sourceName, scrapeType, e);
            return null;
        }
    }

    private PipelineRunSummary unrecordedRun(String sourceName, String scrapeType, Instant startedAt) {
        return new PipelineRunSummary(
            null,
            sourceName,
            scrapeType,
            ScrapeRunStatus.FAILED,
            0,
            0,
            1,
            0,
            "scrape run could not be recorded",
            startedAt,
            clock.instant()
        );
    }

    private PipelineRunSummary closeRun(
        long runId,
        String sourceName,
        String scrapeType,
        ScrapeRunStatus status,
        int added,
        int updated,
        int errors,
        int skipped,
        String errorMessage,
        Instant startedAt
    ) {
        try {
            runLogger.finish(runId, status, added, updated, errors, skipped, errorMessage);
        } catch (RuntimeException e) {
            log.warn("Failed to finalize scrape run {}", runId, e);
        }
        return new PipelineRunSummary(
            runId,
            sourceName,
            scrapeType,
            status,
            added,
            updated,
            errors,
            skipped,
            errorMessage,
            startedAt,
            clock.instant()
        );
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
