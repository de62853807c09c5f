package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.http.PoliteFetcher;
import com.golfdata.clubtracker.crawl.model.FetchOutcome;
import com.golfdata.clubtracker.crawl.model.RawListing;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Paginated category listings plus product detail pages, fetched through the shared
 * {@link PoliteFetcher}. Subclasses supply paths and selectors.
 */
public abstract class AbstractHtmlSourceAdapter implements SourceAdapter {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final PoliteFetcher fetcher;
    private final PipelineProperties properties;
    private final Clock clock;

    protected AbstractHtmlSourceAdapter(PoliteFetcher fetcher, PipelineProperties properties, Clock clock) {
        this.fetcher = fetcher;
        this.properties = properties;
        this.clock = clock;
    }

    protected abstract String defaultBaseUrl();

    protected abstract String categoryPath(String category);

    protected abstract Elements selectProductCards(Document page);

    /**
     * @return the listing, or null when the card carries no usable title
     */
    protected abstract RawListing extractListing(Element card, String category);

    protected abstract Optional<RawListing> extractDetail(Document page, String url);

    protected Map<String, String> pageParams(int page, String brandFilter) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("page", Integer.toString(page));
        if (brandFilter != null && !brandFilter.isBlank()) {
            params.put("brand", brandFilter.trim());
        }
        return params;
    }

    public String baseUrl() {
        String configured = properties.source(key()).getBaseUrl();
        String base = configured == null ? defaultBaseUrl() : configured;
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public CategoryCrawl listCategory(String category, int startPage, String brandFilter) {
        if (!supportsCategory(category)) {
            throw new IllegalArgumentException("Unknown category for " + key() + ": " + category);
        }
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        String url = baseUrl() + categoryPath(normalized);
        return new CategoryCrawl(
            sourceName(),
            normalized,
            startPage,
            properties.getCrawl().getMaxPagesPerCategory(),
            page -> loadPage(url, normalized, page, brandFilter)
        );
    }

    private CategoryPage loadPage(String url, String category, int page, String brandFilter) {
        FetchOutcome outcome = fetcher.fetch(url, pageParams(page, brandFilter));
        if (!outcome.isSuccessful()) {
            return CategoryPage.failed(page, outcome.error());
        }
        Elements cards = selectProductCards(outcome.document());
        List<RawListing> listings = new ArrayList<>();
        int skipped = 0;
        for (Element card : cards) {
            try {
                RawListing listing = extractListing(card, category);
                if (listing == null) {
                    skipped++;
                    log.debug("{} {} page {}: product card without title skipped", sourceName(), category, page);
                } else {
                    listings.add(listing);
                }
            } catch (RuntimeException e) {
                skipped++;
                log.warn("{} {} page {}: failed to extract product card: {}", sourceName(), category, page, e.getMessage());
            }
        }
        log.info(
            "{} {} page {}: {} listings, {} skipped",
            sourceName(),
            category,
            page,
            listings.size(),
            skipped
        );
        return CategoryPage.of(page, listings, cards.size(), skipped);
    }

    @Override
    public Optional<RawListing> fetchDetail(String url) {
        FetchOutcome outcome = fetcher.fetch(url);
        if (!outcome.isSuccessful()) {
            int status = outcome.error() == null ? 0 : outcome.error().statusCode();
            if (status == 404 || status == 410) {
                log.info("{} detail page gone ({}): {}", sourceName(), status, url);
                return Optional.empty();
            }
            throw new SourceFetchException(url, outcome.error());
        }
        try {
            return extractDetail(outcome.document(), url);
        } catch (RuntimeException e) {
            log.warn("{} failed to extract detail page {}: {}", sourceName(), url, e.getMessage());
            return Optional.empty();
        }
    }

    protected int maxModelYear() {
        return LocalDate.now(clock).getYear() + 1;
    }

    protected static String absoluteHref(Element link, String baseUrl) {
        if (link == null) {
            return null;
        }
        String absolute = link.absUrl("href");
        if (!absolute.isBlank()) {
            return absolute;
        }
        String href = link.attr("href");
        if (href == null || href.isBlank()) {
            return null;
        }
        return href.startsWith("/") ? baseUrl + href : baseUrl + "/" + href;
    }

    protected static String text(Element element) {
        return element == null ? null : ListingTextParser.cleanText(element.text());
    }
}
