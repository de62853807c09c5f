package com.golfdata.clubtracker.crawl.model;

import java.time.Instant;

public record ScrapeRun(
    long id,
    String sourceName,
    String scrapeType,
    ScrapeRunStatus status,
    int recordsAdded,
    int recordsUpdated,
    int errorCount,
    int skippedCount,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {}
