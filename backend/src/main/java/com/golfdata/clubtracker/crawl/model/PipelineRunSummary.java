package com.golfdata.clubtracker.crawl.model;

import java.time.Instant;

public record PipelineRunSummary(
    Long runId,
    String sourceName,
    String scrapeType,
    ScrapeRunStatus status,
    int recordsAdded,
    int recordsUpdated,
    int errors,
    int skipped,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {}
