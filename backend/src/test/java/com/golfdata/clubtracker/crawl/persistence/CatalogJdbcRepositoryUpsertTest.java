package com.golfdata.clubtracker.crawl.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.golfdata.clubtracker.crawl.model.Brand;
import com.golfdata.clubtracker.crawl.model.ClubType;
import com.golfdata.clubtracker.crawl.model.ProductSource;
import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.model.StaleProductSource;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository.ClubInsertResult;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository.ProvenanceWrite;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogJdbcRepositoryUpsertTest {

  @Autowired private CatalogJdbcRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbc;

  @Test
  void brandLookupIsCaseInsensitiveAndCreatedOnce() {
    String suffix = suffix();
    Brand created = repository.createBrandIfAbsent("Mizuno" + suffix);
    Brand again = repository.createBrandIfAbsent("MIZUNO" + suffix.toUpperCase());
    Brand found = repository.findBrandByName("  mizuno" + suffix.toLowerCase() + " ");

    assertEquals(created.id(), again.id());
    assertEquals(created.id(), found.id());
    assertEquals("Mizuno" + suffix, found.name());
  }

  @Test
  void seededClubTypesResolveByName() {
    ClubType driver = repository.findClubTypeByName("driver");
    assertEquals("Driver", driver.name());
    assertNull(repository.findClubTypeByName("Chipper-" + suffix()));
  }

  @Test
  void clubIdentityIsUnique() {
    Brand brand = repository.createBrandIfAbsent("Ping" + suffix());
    Instant now = Instant.now();

    ClubInsertResult first =
        repository.insertClubIfAbsent(brand.id(), null, "G430 Max", 2023, null, new BigDecimal("549.99"), now);
    ClubInsertResult second =
        repository.insertClubIfAbsent(brand.id(), null, "G430 Max", 2023, null, new BigDecimal("499.99"), now);
    ClubInsertResult otherYear =
        repository.insertClubIfAbsent(brand.id(), null, "G430 Max", 2024, null, null, now);

    assertTrue(first.created());
    assertFalse(second.created());
    assertEquals(first.club().id(), second.club().id());
    assertTrue(otherYear.created());
    assertEquals(0, new BigDecimal("549.99").compareTo(second.club().currentPrice()));
    assertEquals(2024, repository.findLatestClubByModel(brand.id(), "G430 Max").yearReleased());
    assertEquals(2, repository.findClubsByBrand(brand.id()).size());
  }

  @Test
  void provenanceUpsertKeepsOneRowPerClubAndSource() {
    long clubId = newClub();
    String source = "Shop " + suffix();
    Instant checked = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    ProvenanceWrite first =
        repository.upsertProductSource(clubId, source, "https://shop/1", new BigDecimal("100.00"), true, checked);
    ProvenanceWrite second =
        repository.upsertProductSource(clubId, source, null, new BigDecimal("90.00"), false, checked.plusSeconds(60));

    assertEquals(ProvenanceWrite.INSERTED, first);
    assertEquals(ProvenanceWrite.UPDATED, second);
    assertEquals(1, repository.countProductSources(clubId, source));
    ProductSource stored = repository.findProductSource(clubId, source);
    assertEquals(0, new BigDecimal("90.00").compareTo(stored.price()));
    assertEquals("https://shop/1", stored.productUrl());
    assertFalse(stored.inStock());
    assertEquals(checked.plusSeconds(60), stored.lastChecked());
  }

  @Test
  void olderObservationNeverOverwritesNewer() {
    long clubId = newClub();
    String source = "Shop " + suffix();
    Instant checked = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    repository.upsertProductSource(clubId, source, "https://shop/2", new BigDecimal("80.00"), true, checked);

    ProvenanceWrite stale =
        repository.upsertProductSource(clubId, source, "https://shop/2", new BigDecimal("95.00"), true, checked.minusSeconds(3600));

    assertEquals(ProvenanceWrite.SUPERSEDED, stale);
    assertEquals(0, new BigDecimal("80.00").compareTo(repository.findProductSource(clubId, source).price()));
  }

  @Test
  void absentPriceKeepsStoredPrice() {
    long clubId = newClub();
    String source = "Shop " + suffix();
    Instant checked = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    repository.upsertProductSource(clubId, source, "https://shop/3", new BigDecimal("70.00"), true, checked);

    repository.upsertProductSource(clubId, source, "https://shop/3", null, true, checked.plusSeconds(5));

    assertEquals(0, new BigDecimal("70.00").compareTo(repository.findProductSource(clubId, source).price()));
  }

  @Test
  void staleRowsComeOldestFirstWithinLimit() {
    String source = "Stale " + suffix();
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    long oldest = newClub();
    long middle = newClub();
    long fresh = newClub();
    repository.upsertProductSource(middle, source, "https://shop/m", new BigDecimal("1.00"), true, now.minus(48, ChronoUnit.HOURS));
    repository.upsertProductSource(oldest, source, "https://shop/o", new BigDecimal("1.00"), true, now.minus(72, ChronoUnit.HOURS));
    repository.upsertProductSource(fresh, source, "https://shop/f", new BigDecimal("1.00"), true, now.minus(1, ChronoUnit.HOURS));

    List<StaleProductSource> stale =
        repository.findStaleProductSources(source, now.minus(24, ChronoUnit.HOURS), 10);
    List<StaleProductSource> limited =
        repository.findStaleProductSources(source, now.minus(24, ChronoUnit.HOURS), 1);

    assertEquals(2, stale.size());
    assertEquals(oldest, stale.get(0).clubId());
    assertEquals(middle, stale.get(1).clubId());
    assertEquals(1, limited.size());
    assertEquals(oldest, limited.get(0).clubId());
  }

  @Test
  void finishedScrapeRunIsNeverRewritten() {
    String source = "Runs " + suffix();
    long runId = repository.insertScrapeRun(source, "full", Instant.now());

    boolean first =
        repository.completeScrapeRun(runId, ScrapeRunStatus.SUCCESS, 3, 1, 0, 2, null, Instant.now());
    boolean second =
        repository.completeScrapeRun(runId, ScrapeRunStatus.FAILED, 0, 0, 9, 0, "late", Instant.now());

    assertTrue(first);
    assertFalse(second);
    ScrapeRun run = repository.findScrapeRun(runId);
    assertEquals(ScrapeRunStatus.SUCCESS, run.status());
    assertEquals(3, run.recordsAdded());
    assertEquals(1, run.recordsUpdated());
    assertEquals(2, run.skippedCount());
    assertNull(run.errorMessage());
  }

  @Test
  void staleRunningRunsAreFailed() {
    String source = "Crashed " + suffix();
    long oldRun = repository.insertScrapeRun(source, "full", Instant.now().minus(10, ChronoUnit.HOURS));
    long newRun = repository.insertScrapeRun(source, "full", Instant.now());

    int aborted =
        repository.failStaleRunningRuns(Instant.now().minus(4, ChronoUnit.HOURS), "aborted_on_startup", Instant.now());

    assertTrue(aborted >= 1);
    assertEquals(ScrapeRunStatus.FAILED, repository.findScrapeRun(oldRun).status());
    assertEquals("aborted_on_startup", repository.findScrapeRun(oldRun).errorMessage());
    assertEquals(ScrapeRunStatus.RUNNING, repository.findScrapeRun(newRun).status());
    assertEquals(1, repository.findRunningScrapeRuns(source).size());
    assertEquals(2, repository.findRecentScrapeRuns(source, 10).size());
  }

  @Test
  void longErrorMessagesAreTruncated() {
    long runId = repository.insertScrapeRun("Long " + suffix(), "full", Instant.now());
    repository.completeScrapeRun(runId, ScrapeRunStatus.FAILED, 0, 0, 1, 0, "x".repeat(5000), Instant.now());

    Integer length =
        jdbc.queryForObject(
            "SELECT LENGTH(error_message) FROM scrape_runs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", runId),
            Integer.class);
    assertEquals(1000, length);
  }

  private long newClub() {
    Brand brand = repository.createBrandIfAbsent("Cobra" + suffix());
    return repository
        .insertClubIfAbsent(brand.id(), null, "Aerojet " + suffix(), 2023, null, new BigDecimal("399.99"), Instant.now())
        .club()
        .id();
  }

  private static String suffix() {
    return UUID.randomUUID().toString().substring(0, 6);
  }
}
