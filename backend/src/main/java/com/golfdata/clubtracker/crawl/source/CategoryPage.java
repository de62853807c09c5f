package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.crawl.model.FetchError;
import com.golfdata.clubtracker.crawl.model.RawListing;

import java.util.List;

/**
 * One listing page: the extracted listings and the product cards that could not be read,
 * or the fetch error that prevented reading it.
 */
public record CategoryPage(
    int page,
    List<RawListing> listings,
    int productCards,
    int skipped,
    FetchError error
) {
    public static CategoryPage of(int page, List<RawListing> listings, int productCards, int skipped) {
        return new CategoryPage(page, List.copyOf(listings), productCards, skipped, null);
    }

    public static CategoryPage failed(int page, FetchError error) {
        return new CategoryPage(page, List.of(), 0, 0, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isEmpty() {
        return error == null && productCards == 0;
    }
}
