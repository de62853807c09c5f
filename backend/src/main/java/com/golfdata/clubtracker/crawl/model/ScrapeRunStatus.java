package com.golfdata.clubtracker.crawl.model;

import java.util.Locale;

public enum ScrapeRunStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static ScrapeRunStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return ScrapeRunStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
