package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.http.PoliteFetcher;
import com.golfdata.clubtracker.crawl.model.RawListing;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class GlobalGolfSourceAdapter extends AbstractHtmlSourceAdapter {
    public static final String KEY = "globalgolf";
    public static final String SOURCE_NAME = "Global Golf";
    private static final String DEFAULT_BASE_URL = "https://www.globalgolf.com";

    private static final Map<String, String> CATEGORY_PATHS = new LinkedHashMap<>();

    static {
        CATEGORY_PATHS.put("drivers", "/golf-clubs/drivers/");
        CATEGORY_PATHS.put("fairway-woods", "/golf-clubs/fairway-woods/");
        CATEGORY_PATHS.put("hybrids", "/golf-clubs/hybrids/");
        CATEGORY_PATHS.put("irons", "/golf-clubs/irons/");
        CATEGORY_PATHS.put("wedges", "/golf-clubs/wedges/");
        CATEGORY_PATHS.put("putters", "/golf-clubs/putters/");
    }

    public GlobalGolfSourceAdapter(PoliteFetcher fetcher, PipelineProperties properties, Clock clock) {
        super(fetcher, properties, clock);
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<String> categories() {
        return List.copyOf(CATEGORY_PATHS.keySet());
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected String categoryPath(String category) {
        return CATEGORY_PATHS.get(category);
    }

    @Override
    protected Elements selectProductCards(Document page) {
        return page.select("div.product-item");
    }

    @Override
    protected RawListing extractListing(Element card, String category) {
        String title = text(card.selectFirst("h3.product-name"));
        ListingTextParser.TitleParts parts = ListingTextParser.splitTitle(title);
        if (parts == null) {
            return null;
        }
        Element priceElement = card.selectFirst("span.price");
        BigDecimal price = priceElement == null ? null : ListingTextParser.parsePrice(priceElement.text());
        Element listPriceElement = card.selectFirst("span.list-price");
        BigDecimal listPrice = listPriceElement == null ? null : ListingTextParser.parsePrice(listPriceElement.text());
        return new RawListing(
            SOURCE_NAME,
            parts.brand(),
            parts.model(),
            category,
            price,
            absoluteHref(card.selectFirst("a.product-link"), baseUrl()),
            !isOutOfStock(card),
            ListingTextParser.extractYear(title, maxModelYear()),
            listPrice
        );
    }

    @Override
    protected Optional<RawListing> extractDetail(Document page, String url) {
        String title = text(page.selectFirst("h1.product-title"));
        Element priceElement = page.selectFirst("span.price");
        BigDecimal price = priceElement == null ? null : ListingTextParser.parsePrice(priceElement.text());
        if (title == null && price == null) {
            return Optional.empty();
        }
        Map<String, String> specs = specifications(page);
        ListingTextParser.TitleParts parts = ListingTextParser.splitTitle(title);
        Integer year = firstYear(specs, "model year", "release year", "year");
        if (year == null) {
            year = ListingTextParser.extractYear(title, maxModelYear());
        }
        Element listPriceElement = page.selectFirst("span.list-price");
        return Optional.of(new RawListing(
            SOURCE_NAME,
            parts == null ? null : parts.brand(),
            parts == null ? null : parts.model(),
            specs.get("club type"),
            price,
            url,
            !isOutOfStock(page),
            year,
            listPriceElement == null ? null : ListingTextParser.parsePrice(listPriceElement.text())
        ));
    }

    private Map<String, String> specifications(Document page) {
        Map<String, String> specs = new LinkedHashMap<>();
        Element table = page.selectFirst("table.specifications");
        if (table == null) {
            return specs;
        }
        for (Element row : table.select("tr")) {
            Elements cols = row.select("th, td");
            if (cols.size() < 2) {
                continue;
            }
            String key = ListingTextParser.key(cols.get(0).text());
            String value = ListingTextParser.cleanText(cols.get(1).text());
            if (!key.isEmpty() && value != null) {
                specs.put(key, value);
            }
        }
        return specs;
    }

    private Integer firstYear(Map<String, String> specs, String... keys) {
        for (String key : keys) {
            Integer year = ListingTextParser.extractYear(specs.get(key), maxModelYear());
            if (year != null) {
                return year;
            }
        }
        return null;
    }

    private boolean isOutOfStock(Element scope) {
        Element stock = scope.selectFirst(".stock-status, .availability");
        if (stock == null) {
            return scope.hasClass("out-of-stock");
        }
        return stock.text().toLowerCase(Locale.ROOT).contains("out of stock");
    }
}
