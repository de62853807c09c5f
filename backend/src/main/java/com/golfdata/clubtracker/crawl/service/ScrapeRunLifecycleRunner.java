package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Closes runs a crashed process left {@code running}, so they stop blocking new runs of the
 * same source.
 */
@Component
@Order(0)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);
    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final CatalogJdbcRepository repository;
    private final PipelineProperties properties;
    private final Clock clock;

    public ScrapeRunLifecycleRunner(CatalogJdbcRepository repository, PipelineProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return;
        }
        cleanupStaleRuns();
    }

    public int cleanupStaleRuns() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        int aborted = repository.failStaleRunningRuns(cutoff, ABORTED_ON_STARTUP, now);
        if (aborted > 0) {
            log.info("Marked {} stale scrape run(s) started before {} as failed", aborted, cutoff);
        }
        return aborted;
    }
}
