package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.Brand;
import com.golfdata.clubtracker.crawl.model.CanonicalClub;
import com.golfdata.clubtracker.crawl.model.RawListing;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ReconciliationConcurrencyTest {
    private static final int WORKERS = 8;
    private static final List<String> SOURCES = List.of("Global Golf", "Fairway Outlet");

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private CatalogJdbcRepository repository;

    private final ExecutorService executor = Executors.newFixedThreadPool(WORKERS);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentDiscoveryOfOneClubCreatesItOnce() throws Exception {
        String brand = "Mizuno" + UUID.randomUUID().toString().substring(0, 6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReconciliationTally>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            RawListing listing = new RawListing(
                SOURCES.get(i % SOURCES.size()), brand, "ST-Z 230 Driver", "drivers",
                new BigDecimal("449.99"), "https://shop.example/" + brand + "/st-z-230", true, 2023, null
            );
            futures.add(executor.submit(() -> {
                start.await();
                return reconciliationService.reconcileAll(List.of(listing));
            }));
        }
        start.countDown();

        int inserted = 0;
        int errors = 0;
        for (Future<ReconciliationTally> future : futures) {
            ReconciliationTally tally = future.get(30, TimeUnit.SECONDS);
            inserted += tally.inserted();
            errors += tally.errors();
        }

        Brand stored = repository.findBrandByName(brand);
        List<CanonicalClub> clubs = repository.findClubsByBrand(stored.id());
        assertThat(errors).isZero();
        assertThat(inserted).isEqualTo(1);
        assertThat(clubs).hasSize(1);
        for (String source : SOURCES) {
            assertThat(repository.countProductSources(clubs.get(0).id(), source)).isEqualTo(1);
        }
    }
}
