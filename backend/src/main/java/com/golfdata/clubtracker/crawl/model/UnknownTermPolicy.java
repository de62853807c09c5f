package com.golfdata.clubtracker.crawl.model;

/**
 * What reconciliation does with a brand or club type it has never seen.
 */
public enum UnknownTermPolicy {
    /** Create the term on first sighting. */
    CREATE,
    /** Drop the listing and log the term for manual review. */
    REJECT
}
