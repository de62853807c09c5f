package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class ScrapeRunLogger {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLogger.class);

    private final CatalogJdbcRepository repository;
    private final Clock clock;

    public ScrapeRunLogger(CatalogJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public long open(String sourceName, String scrapeType) {
        long runId = repository.insertScrapeRun(sourceName, scrapeType, clock.instant());
        log.info("Scrape run {} started: source={} type={}", runId, sourceName, scrapeType);
        return runId;
    }

    /**
     * Finalizes a running row. Returns false when the row was already finished or does not exist.
     */
    public boolean finish(
        long runId,
        ScrapeRunStatus status,
        int recordsAdded,
        int recordsUpdated,
        int errors,
        int skipped,
        String errorMessage
    ) {
        boolean finished = repository.completeScrapeRun(
            runId,
            status,
            recordsAdded,
            recordsUpdated,
            errors,
            skipped,
            errorMessage,
            clock.instant()
        );
        if (finished) {
            log.info(
                "Scrape run {} finished {}: added={}, updated={}, errors={}, skipped={}",
                runId,
                status.dbValue(),
                recordsAdded,
                recordsUpdated,
                errors,
                skipped
            );
        } else {
            log.warn("Scrape run {} was not running, final status {} not recorded", runId, status.dbValue());
        }
        return finished;
    }

    public ScrapeRun find(long runId) {
        return repository.findScrapeRun(runId);
    }

    public static ScrapeRunStatus statusFor(int errors) {
        return errors == 0 ? ScrapeRunStatus.SUCCESS : ScrapeRunStatus.PARTIAL;
    }
}
