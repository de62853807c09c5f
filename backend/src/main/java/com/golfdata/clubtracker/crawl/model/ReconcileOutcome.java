package com.golfdata.clubtracker.crawl.model;

public enum ReconcileOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED,
    REJECTED
}
