package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.model.CanonicalClub;
import com.golfdata.clubtracker.crawl.model.RawListing;
import com.golfdata.clubtracker.crawl.model.StaleProductSource;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import com.golfdata.clubtracker.crawl.source.SourceAdapter;
import com.golfdata.clubtracker.crawl.source.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Picks provenance rows not checked within the refresh interval and re-reads their detail pages.
 * Failed rows keep their old {@code last_checked} and come back on the next pass.
 */
@Service
public class StalenessScheduler {
    private static final Logger log = LoggerFactory.getLogger(StalenessScheduler.class);

    private final CatalogJdbcRepository repository;
    private final ReconciliationService reconciliationService;
    private final PipelineProperties properties;
    private final Clock clock;

    public StalenessScheduler(
        CatalogJdbcRepository repository,
        ReconciliationService reconciliationService,
        PipelineProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.reconciliationService = reconciliationService;
        this.properties = properties;
        this.clock = clock;
    }

    public List<StaleProductSource> selectStale(String sourceName, Integer batchSize) {
        int limit = batchSize == null || batchSize <= 0 ? properties.getRefresh().getBatchSize() : batchSize;
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getRefresh().getIntervalHours()));
        return repository.findStaleProductSources(sourceName, cutoff, limit);
    }

    public RefreshTally refresh(SourceAdapter adapter, List<StaleProductSource> rows) {
        int updated = 0;
        int unchanged = 0;
        int errors = 0;
        String lastError = null;
        for (StaleProductSource row : rows) {
            try {
                Optional<RawListing> detail = adapter.fetchDetail(row.productUrl());
                if (detail.isEmpty()) {
                    errors++;
                    lastError = "detail_not_found: " + row.productUrl();
                    log.warn("No usable detail for {} {} at {}", row.brandName(), row.modelName(), row.productUrl());
                    continue;
                }
                CanonicalClub club = repository.findClubById(row.clubId());
                if (club == null) {
                    errors++;
                    lastError = "club_missing: " + row.clubId();
                    log.warn("Provenance row {} points at missing club {}", row.productSourceId(), row.clubId());
                    continue;
                }
                RawListing observed = detail.get();
                boolean changed = reconciliationService.applyObservation(
                    club,
                    row.sourceName(),
                    row.productUrl(),
                    observed.price(),
                    observed.inStock(),
                    clock.instant()
                );
                if (changed) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (SourceFetchException e) {
                errors++;
                lastError = e.getMessage();
                log.warn("Refresh fetch failed for {} {}: {}", row.brandName(), row.modelName(), e.getMessage());
            } catch (RuntimeException e) {
                errors++;
                lastError = e.getMessage();
                log.warn("Refresh failed for provenance row {}", row.productSourceId(), e);
            }
        }
        log.info(
            "Refreshed {} stale rows from {}: updated={}, unchanged={}, errors={}",
            rows.size(),
            adapter.sourceName(),
            updated,
            unchanged,
            errors
        );
        return new RefreshTally(rows.size(), updated, unchanged, errors, lastError);
    }
}
