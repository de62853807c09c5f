package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.crawl.model.FetchError;

public class SourceFetchException extends RuntimeException {
    private final String url;
    private final FetchError error;

    public SourceFetchException(String url, FetchError error) {
        super("Fetch failed for " + url + ": " + (error == null ? "unknown" : error.describe()));
        this.url = url;
        this.error = error;
    }

    public String getUrl() {
        return url;
    }

    public FetchError getError() {
        return error;
    }
}
