package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeRunLoggerTest {

    @Autowired
    private ScrapeRunLogger runLogger;

    @Test
    void openWritesRunningRowAndFinishFinalizesOnce() {
        long runId = runLogger.open("Logger " + UUID.randomUUID(), "filtered_drivers");

        ScrapeRun opened = runLogger.find(runId);
        assertThat(opened.status()).isEqualTo(ScrapeRunStatus.RUNNING);
        assertThat(opened.scrapeType()).isEqualTo("filtered_drivers");
        assertThat(opened.completedAt()).isNull();

        assertThat(runLogger.finish(runId, ScrapeRunStatus.PARTIAL, 4, 2, 1, 3, "drivers: timeout")).isTrue();
        assertThat(runLogger.finish(runId, ScrapeRunStatus.SUCCESS, 0, 0, 0, 0, null)).isFalse();

        ScrapeRun finished = runLogger.find(runId);
        assertThat(finished.status()).isEqualTo(ScrapeRunStatus.PARTIAL);
        assertThat(finished.recordsAdded()).isEqualTo(4);
        assertThat(finished.errorCount()).isEqualTo(1);
        assertThat(finished.errorMessage()).isEqualTo("drivers: timeout");
        assertThat(finished.completedAt()).isNotNull();
    }

    @Test
    void runningIsNotATerminalStatus() {
        long runId = runLogger.open("Logger " + UUID.randomUUID(), "full");

        assertThatThrownBy(() -> runLogger.finish(runId, ScrapeRunStatus.RUNNING, 0, 0, 0, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusFollowsErrorCount() {
        assertThat(ScrapeRunLogger.statusFor(0)).isEqualTo(ScrapeRunStatus.SUCCESS);
        assertThat(ScrapeRunLogger.statusFor(2)).isEqualTo(ScrapeRunStatus.PARTIAL);
    }
}
