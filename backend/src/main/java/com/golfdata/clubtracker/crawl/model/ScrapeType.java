package com.golfdata.clubtracker.crawl.model;

import java.util.Locale;

public final class ScrapeType {
    public static final String FULL = "full";
    public static final String UPDATE_PRICES = "update_prices";
    private static final String FILTERED_PREFIX = "filtered_";

    private ScrapeType() {}

    public static String forCrawl(String category) {
        if (category == null || category.isBlank()) {
            return FULL;
        }
        return FILTERED_PREFIX + category.trim().toLowerCase(Locale.ROOT);
    }
}
