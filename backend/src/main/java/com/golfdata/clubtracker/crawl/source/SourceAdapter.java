package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.crawl.model.RawListing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A retailer the pipeline can crawl. Implementations are Spring beans picked up by
 * {@link SourceAdapterRegistry}.
 */
public interface SourceAdapter {

    /** Configuration key, also used on the CLI and REST triggers. */
    String key();

    /** Name stored on provenance rows and scrape runs. */
    String sourceName();

    List<String> categories();

    CategoryCrawl listCategory(String category, int startPage, String brandFilter);

    /**
     * Reads one product detail page. Empty when the page is gone or carries nothing usable.
     *
     * @throws SourceFetchException when the page could not be fetched
     */
    Optional<RawListing> fetchDetail(String url);

    default boolean supportsCategory(String category) {
        return category != null && categories().contains(category.trim().toLowerCase(Locale.ROOT));
    }
}
