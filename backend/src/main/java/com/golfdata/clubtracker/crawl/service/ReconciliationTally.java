package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.ReconcileOutcome;

public class ReconciliationTally {
    private int inserted;
    private int updated;
    private int unchanged;
    private int rejected;
    private int errors;
    private String lastError;

    public void count(ReconcileOutcome outcome) {
        switch (outcome) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
            case UNCHANGED -> unchanged++;
            case REJECTED -> rejected++;
        }
    }

    public void countError(String message) {
        errors++;
        lastError = message;
    }

    public int inserted() {
        return inserted;
    }

    public int updated() {
        return updated;
    }

    public int unchanged() {
        return unchanged;
    }

    public int rejected() {
        return rejected;
    }

    public int errors() {
        return errors;
    }

    public String lastError() {
        return lastError;
    }
}
