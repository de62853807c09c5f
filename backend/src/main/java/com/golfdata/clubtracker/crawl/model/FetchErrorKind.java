package com.golfdata.clubtracker.crawl.model;

public enum FetchErrorKind {
    TRANSIENT,
    PERMANENT
}
