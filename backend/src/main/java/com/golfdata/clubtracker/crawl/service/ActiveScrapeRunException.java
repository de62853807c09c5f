package com.golfdata.clubtracker.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScrapeRunException extends RuntimeException {
    private final long runId;

    public ActiveScrapeRunException(String sourceName, long runId) {
        super("Scrape run " + runId + " for " + sourceName + " is still running");
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
