package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.model.Brand;
import com.golfdata.clubtracker.crawl.model.ClubType;
import com.golfdata.clubtracker.crawl.model.UnknownTermPolicy;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import com.golfdata.clubtracker.crawl.source.ListingTextParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves listing brand and club type text to catalog rows, creating unknown terms or
 * rejecting the listing depending on {@code pipeline.reconciliation.*}.
 */
@Service
public class CatalogTermResolver {
    private static final Logger log = LoggerFactory.getLogger(CatalogTermResolver.class);
    private static final int MIN_PARTIAL_MATCH_LENGTH = 3;

    private final CatalogJdbcRepository repository;
    private final ClubTypeVocabulary vocabulary;
    private final PipelineProperties properties;

    public CatalogTermResolver(
        CatalogJdbcRepository repository,
        ClubTypeVocabulary vocabulary,
        PipelineProperties properties
    ) {
        this.repository = repository;
        this.vocabulary = vocabulary;
        this.properties = properties;
    }

    public Resolution<Brand> resolveBrand(String brandText) {
        String cleaned = ListingTextParser.cleanText(brandText);
        if (cleaned == null) {
            throw new IllegalArgumentException("Listing has no brand");
        }
        Brand exact = repository.findBrandByName(cleaned);
        if (exact != null) {
            return Resolution.of(exact);
        }
        Brand partial = findPartialMatch(cleaned);
        if (partial != null) {
            log.debug("Brand text '{}' matched known brand '{}'", cleaned, partial.name());
            return Resolution.of(partial);
        }
        if (properties.getReconciliation().getUnknownBrandPolicy() == UnknownTermPolicy.REJECT) {
            log.warn("Unknown brand '{}' rejected, listing held for review", cleaned);
            return Resolution.reject();
        }
        Brand created = repository.createBrandIfAbsent(cleaned);
        log.info("Created brand '{}' (id={})", created.name(), created.id());
        return Resolution.of(created);
    }

    /**
     * A blank type resolves to no type. It does not reject the listing.
     */
    public Resolution<ClubType> resolveClubType(String clubTypeText) {
        String canonical = vocabulary.canonicalName(clubTypeText);
        if (canonical == null) {
            return Resolution.of(null);
        }
        ClubType existing = repository.findClubTypeByName(canonical);
        if (existing != null) {
            return Resolution.of(existing);
        }
        if (properties.getReconciliation().getUnknownClubTypePolicy() == UnknownTermPolicy.REJECT) {
            log.warn("Unknown club type '{}' rejected, listing held for review", canonical);
            return Resolution.reject();
        }
        ClubType created = repository.createClubTypeIfAbsent(canonical);
        log.info("Created club type '{}' (id={})", created.name(), created.id());
        return Resolution.of(created);
    }

    private Brand findPartialMatch(String brandText) {
        String text = ListingTextParser.key(brandText);
        List<Brand> known = repository.findBrands();
        for (Brand brand : known) {
            String name = ListingTextParser.key(brand.name());
            if (name.length() >= MIN_PARTIAL_MATCH_LENGTH && text.startsWith(name + " ")) {
                return brand;
            }
        }
        for (Brand brand : known) {
            String name = ListingTextParser.key(brand.name());
            if (name.length() >= MIN_PARTIAL_MATCH_LENGTH && (" " + text + " ").contains(" " + name + " ")) {
                return brand;
            }
        }
        return null;
    }

    public record Resolution<T>(T value, boolean rejected) {
        static <T> Resolution<T> of(T value) {
            return new Resolution<>(value, false);
        }

        static <T> Resolution<T> reject() {
            return new Resolution<>(null, true);
        }
    }
}
