package com.golfdata.clubtracker.crawl.model;

public record FullCrawlRequest(
    String source,
    String category,
    String brandFilter,
    Boolean enrichDetails
) {
    public static FullCrawlRequest of(String source) {
        return new FullCrawlRequest(source, null, null, null);
    }

    public String normalizedCategory() {
        return category == null || category.isBlank() ? null : category.trim();
    }

    public String normalizedBrandFilter() {
        return brandFilter == null || brandFilter.isBlank() ? null : brandFilter.trim();
    }
}
