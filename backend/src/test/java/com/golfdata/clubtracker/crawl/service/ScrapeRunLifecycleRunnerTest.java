package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeRunLifecycleRunnerTest {

    @Autowired
    private ScrapeRunLifecycleRunner lifecycleRunner;

    @Autowired
    private CatalogJdbcRepository repository;

    @Test
    void runsLeftBehindByCrashedProcessAreFailed() {
        String source = "Crash " + UUID.randomUUID();
        long abandoned = repository.insertScrapeRun(source, "full", Instant.now().minus(6, ChronoUnit.HOURS));
        long recent = repository.insertScrapeRun(source, "update_prices", Instant.now().minus(10, ChronoUnit.MINUTES));

        int aborted = lifecycleRunner.cleanupStaleRuns();

        assertThat(aborted).isGreaterThanOrEqualTo(1);
        ScrapeRun failed = repository.findScrapeRun(abandoned);
        assertThat(failed.status()).isEqualTo(ScrapeRunStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo(ScrapeRunLifecycleRunner.ABORTED_ON_STARTUP);
        assertThat(failed.completedAt()).isNotNull();
        assertThat(repository.findScrapeRun(recent).status()).isEqualTo(ScrapeRunStatus.RUNNING);
    }
}
