package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.Brand;
import com.golfdata.clubtracker.crawl.model.CanonicalClub;
import com.golfdata.clubtracker.crawl.model.ClubType;
import com.golfdata.clubtracker.crawl.model.ProductSource;
import com.golfdata.clubtracker.crawl.model.RawListing;
import com.golfdata.clubtracker.crawl.model.ReconcileOutcome;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository.ClubInsertResult;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository.ProvenanceWrite;
import com.golfdata.clubtracker.crawl.source.ListingTextParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Folds extracted listings into the catalog: one club per (brand, model, year), one provenance
 * row per (club, source), current price tracking the latest observation.
 */
@Service
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final CatalogJdbcRepository repository;
    private final CatalogTermResolver termResolver;
    private final Clock clock;

    public ReconciliationService(CatalogJdbcRepository repository, CatalogTermResolver termResolver, Clock clock) {
        this.repository = repository;
        this.termResolver = termResolver;
        this.clock = clock;
    }

    public ReconciliationTally reconcileAll(Iterable<RawListing> listings) {
        ReconciliationTally tally = new ReconciliationTally();
        for (RawListing listing : listings) {
            reconcileInto(listing, tally);
        }
        return tally;
    }

    /**
     * Reconciles one listing, recording failures on the tally instead of throwing.
     */
    public void reconcileInto(RawListing listing, ReconciliationTally tally) {
        try {
            tally.count(reconcile(listing));
        } catch (RuntimeException e) {
            String label = listing == null ? "null listing" : listing.brandText() + " " + listing.modelText();
            log.warn("Failed to reconcile {}: {}", label, e.getMessage(), e);
            tally.countError(e.getMessage());
        }
    }

    public ReconcileOutcome reconcile(RawListing listing) {
        if (listing == null) {
            throw new IllegalArgumentException("Listing is required");
        }
        String modelName = ListingTextParser.cleanText(listing.modelText());
        if (modelName == null) {
            throw new IllegalArgumentException("Listing has no model name");
        }
        CatalogTermResolver.Resolution<Brand> brand = termResolver.resolveBrand(listing.brandText());
        if (brand.rejected()) {
            return ReconcileOutcome.REJECTED;
        }
        CatalogTermResolver.Resolution<ClubType> clubType = termResolver.resolveClubType(listing.clubType());
        if (clubType.rejected()) {
            return ReconcileOutcome.REJECTED;
        }

        Instant now = clock.instant();
        CanonicalClub club = null;
        boolean created = false;
        if (listing.modelYear() == null) {
            club = repository.findLatestClubByModel(brand.value().id(), modelName);
        }
        if (club == null) {
            int year = listing.modelYear() != null ? listing.modelYear() : LocalDate.now(clock).getYear();
            ClubInsertResult inserted = repository.insertClubIfAbsent(
                brand.value().id(),
                clubType.value() == null ? null : clubType.value().id(),
                modelName,
                year,
                listing.listPrice(),
                listing.price(),
                now
            );
            club = inserted.club();
            created = inserted.created();
            if (created) {
                log.debug("Inserted club {} {} ({})", club.brand(), club.modelName(), club.yearReleased());
            }
        }

        boolean changed = applyObservation(club, listing.source(), listing.detailUrl(), listing.price(), listing.inStock(), now);
        if (created) {
            return ReconcileOutcome.INSERTED;
        }
        return changed ? ReconcileOutcome.UPDATED : ReconcileOutcome.UNCHANGED;
    }

    /**
     * Upserts the club's provenance for one source and moves its current price when the observed
     * price differs.
     *
     * @return whether the provenance row or the club price changed
     */
    public boolean applyObservation(
        CanonicalClub club,
        String sourceName,
        String productUrl,
        BigDecimal price,
        boolean inStock,
        Instant checkedAt
    ) {
        ProductSource before = repository.findProductSource(club.id(), sourceName);
        ProvenanceWrite write = repository.upsertProductSource(club.id(), sourceName, productUrl, price, inStock, checkedAt);
        if (write == ProvenanceWrite.SUPERSEDED) {
            log.debug("Observation of club {} from {} is older than the stored one, ignored", club.id(), sourceName);
            return false;
        }
        boolean provenanceChanged = write == ProvenanceWrite.INSERTED
            || before == null
            || (price != null && !samePrice(before.price(), price))
            || before.inStock() != inStock
            || (productUrl != null && !Objects.equals(before.productUrl(), productUrl));

        boolean priceChanged = false;
        if (price != null && !samePrice(club.currentPrice(), price)) {
            repository.updateClubCurrentPrice(club.id(), price, checkedAt);
            priceChanged = true;
            log.info(
                "Price of {} {} moved {} -> {} ({})",
                club.brand(),
                club.modelName(),
                club.currentPrice(),
                price,
                sourceName
            );
        }
        return provenanceChanged || priceChanged;
    }

    private static boolean samePrice(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
