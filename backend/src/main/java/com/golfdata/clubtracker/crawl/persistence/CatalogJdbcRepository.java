package com.golfdata.clubtracker.crawl.persistence;

import com.golfdata.clubtracker.crawl.model.Brand;
import com.golfdata.clubtracker.crawl.model.CanonicalClub;
import com.golfdata.clubtracker.crawl.model.ClubType;
import com.golfdata.clubtracker.crawl.model.ProductSource;
import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.model.ScrapeRunStatus;
import com.golfdata.clubtracker.crawl.model.StaleProductSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class CatalogJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CatalogJdbcRepository.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private static final String CLUB_SELECT = """
        SELECT gc.id,
               gc.brand_id,
               b.name AS brand_name,
               gc.club_type_id,
               ct.name AS club_type_name,
               gc.model_name,
               gc.year_released,
               gc.msrp,
               gc.current_price,
               gc.is_current,
               gc.created_at,
               gc.updated_at
        FROM golf_clubs gc
        JOIN brands b ON b.id = gc.brand_id
        LEFT JOIN club_types ct ON ct.id = gc.club_type_id
        """;

    private static final String SCRAPE_RUN_SELECT = """
        SELECT id,
               source_name,
               scrape_type,
               status,
               records_added,
               records_updated,
               error_count,
               skipped_count,
               error_message,
               started_at,
               completed_at
        FROM scrape_runs
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("brands", countTable("brands"));
        counts.put("club_types", countTable("club_types"));
        counts.put("golf_clubs", countTable("golf_clubs"));
        counts.put("product_sources", countTable("product_sources"));
        counts.put("scrape_runs", countTable("scrape_runs"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    // brands

    public List<Brand> findBrands() {
        return jdbc.query(
            """
                SELECT id, name
                FROM brands
                ORDER BY LENGTH(name) DESC, name
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new Brand(rs.getLong("id"), rs.getString("name"))
        );
    }

    public Brand findBrandByName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("nameKey", brandKey(name));
        List<Brand> rows = jdbc.query(
            """
                SELECT id, name
                FROM brands
                WHERE name_key = :nameKey
                """,
            params,
            (rs, rowNum) -> new Brand(rs.getLong("id"), rs.getString("name"))
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Lookup-or-create. A unique-key violation means another writer created the brand first.
     */
    public Brand createBrandIfAbsent(String name) {
        String trimmed = name.trim();
        Brand existing = findBrandByName(trimmed);
        if (existing != null) {
            return existing;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", trimmed)
            .addValue("nameKey", brandKey(trimmed));
        try {
            jdbc.update(
                """
                    INSERT INTO brands (name, name_key)
                    VALUES (:name, :nameKey)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Brand {} created concurrently, re-reading", trimmed);
        }
        Brand created = findBrandByName(trimmed);
        if (created == null) {
            throw new IllegalStateException("Failed to create brand " + trimmed);
        }
        return created;
    }

    // club types

    public ClubType findClubTypeByName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name.trim().toLowerCase(Locale.ROOT));
        List<ClubType> rows = jdbc.query(
            """
                SELECT id, name
                FROM club_types
                WHERE LOWER(name) = :name
                """,
            params,
            (rs, rowNum) -> new ClubType(rs.getLong("id"), rs.getString("name"))
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public ClubType createClubTypeIfAbsent(String name) {
        String trimmed = name.trim();
        ClubType existing = findClubTypeByName(trimmed);
        if (existing != null) {
            return existing;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO club_types (name)
                    VALUES (:name)
                    """,
                new MapSqlParameterSource().addValue("name", trimmed)
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Club type {} created concurrently, re-reading", trimmed);
        }
        ClubType created = findClubTypeByName(trimmed);
        if (created == null) {
            throw new IllegalStateException("Failed to create club type " + trimmed);
        }
        return created;
    }

    // golf clubs

    public CanonicalClub findClubById(long clubId) {
        List<CanonicalClub> rows = jdbc.query(
            CLUB_SELECT + " WHERE gc.id = :clubId",
            new MapSqlParameterSource().addValue("clubId", clubId),
            clubRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public CanonicalClub findClubByIdentity(long brandId, String modelName, int yearReleased) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("brandId", brandId)
            .addValue("modelName", modelName)
            .addValue("yearReleased", yearReleased);
        List<CanonicalClub> rows = jdbc.query(
            CLUB_SELECT + """
                 WHERE gc.brand_id = :brandId
                   AND gc.model_name = :modelName
                   AND gc.year_released = :yearReleased
                """,
            params,
            clubRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Most recent release of a model, for listings that carry no year of their own.
     */
    public CanonicalClub findLatestClubByModel(long brandId, String modelName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("brandId", brandId)
            .addValue("modelName", modelName);
        List<CanonicalClub> rows = jdbc.query(
            CLUB_SELECT + """
                 WHERE gc.brand_id = :brandId
                   AND gc.model_name = :modelName
                 ORDER BY gc.year_released DESC
                 LIMIT 1
                """,
            params,
            clubRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CanonicalClub> findClubsByBrand(long brandId) {
        return jdbc.query(
            CLUB_SELECT + " WHERE gc.brand_id = :brandId ORDER BY gc.model_name, gc.year_released",
            new MapSqlParameterSource().addValue("brandId", brandId),
            clubRowMapper()
        );
    }

    /**
     * Inserts the club unless its identity already exists. The loser of a concurrent insert
     * gets the winner's row back with {@code created = false}.
     */
    public ClubInsertResult insertClubIfAbsent(
        long brandId,
        Long clubTypeId,
        String modelName,
        int yearReleased,
        BigDecimal msrp,
        BigDecimal currentPrice,
        Instant now
    ) {
        CanonicalClub existing = findClubByIdentity(brandId, modelName, yearReleased);
        if (existing != null) {
            return new ClubInsertResult(existing, false);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("brandId", brandId)
            .addValue("clubTypeId", clubTypeId, Types.BIGINT)
            .addValue("modelName", modelName)
            .addValue("yearReleased", yearReleased)
            .addValue("msrp", msrp, Types.NUMERIC)
            .addValue("currentPrice", currentPrice, Types.NUMERIC)
            .addValue("now", toTimestamp(now));
        boolean created = true;
        try {
            jdbc.update(
                """
                    INSERT INTO golf_clubs (
                        brand_id,
                        club_type_id,
                        model_name,
                        year_released,
                        msrp,
                        current_price,
                        is_current,
                        created_at,
                        updated_at
                    )
                    VALUES (
                        :brandId,
                        :clubTypeId,
                        :modelName,
                        :yearReleased,
                        :msrp,
                        :currentPrice,
                        TRUE,
                        :now,
                        :now
                    )
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            created = false;
            log.debug("Club {} ({}) inserted concurrently, re-reading", modelName, yearReleased);
        }
        CanonicalClub club = findClubByIdentity(brandId, modelName, yearReleased);
        if (club == null) {
            throw new IllegalStateException("Failed to insert club " + modelName + " (" + yearReleased + ")");
        }
        return new ClubInsertResult(club, created);
    }

    public int updateClubCurrentPrice(long clubId, BigDecimal price, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("clubId", clubId)
            .addValue("price", price)
            .addValue("updatedAt", toTimestamp(updatedAt));
        return jdbc.update(
            """
                UPDATE golf_clubs
                SET current_price = :price,
                    updated_at = :updatedAt
                WHERE id = :clubId
                """,
            params
        );
    }

    // product sources

    public ProductSource findProductSource(long clubId, String sourceName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("clubId", clubId)
            .addValue("sourceName", sourceName);
        List<ProductSource> rows = jdbc.query(
            """
                SELECT id,
                       golf_club_id,
                       source_name,
                       product_url,
                       price,
                       in_stock,
                       last_checked
                FROM product_sources
                WHERE golf_club_id = :clubId
                  AND source_name = :sourceName
                """,
            params,
            (rs, rowNum) -> new ProductSource(
                rs.getLong("id"),
                rs.getLong("golf_club_id"),
                rs.getString("source_name"),
                rs.getString("product_url"),
                rs.getBigDecimal("price"),
                rs.getBoolean("in_stock"),
                toInstant(rs.getTimestamp("last_checked"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public int countProductSources(long clubId, String sourceName) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM product_sources
                WHERE golf_club_id = :clubId
                  AND source_name = :sourceName
                """,
            new MapSqlParameterSource().addValue("clubId", clubId).addValue("sourceName", sourceName),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    /**
     * Upsert keyed by (club, source). Writes older than the stored {@code last_checked} are dropped.
     */
    public ProvenanceWrite upsertProductSource(
        long clubId,
        String sourceName,
        String productUrl,
        BigDecimal price,
        boolean inStock,
        Instant checkedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("clubId", clubId)
            .addValue("sourceName", sourceName)
            .addValue("productUrl", productUrl, Types.VARCHAR)
            .addValue("price", price, Types.NUMERIC)
            .addValue("inStock", inStock)
            .addValue("checkedAt", toTimestamp(checkedAt));
        String update = """
            UPDATE product_sources
            SET product_url = COALESCE(:productUrl, product_url),
                price = COALESCE(:price, price),
                in_stock = :inStock,
                last_checked = :checkedAt
            WHERE golf_club_id = :clubId
              AND source_name = :sourceName
              AND (last_checked IS NULL OR last_checked <= :checkedAt)
            """;
        if (jdbc.update(update, params) > 0) {
            return ProvenanceWrite.UPDATED;
        }
        if (countProductSources(clubId, sourceName) > 0) {
            return ProvenanceWrite.SUPERSEDED;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO product_sources (
                        golf_club_id,
                        source_name,
                        product_url,
                        price,
                        in_stock,
                        last_checked,
                        created_at
                    )
                    VALUES (
                        :clubId,
                        :sourceName,
                        :productUrl,
                        :price,
                        :inStock,
                        :checkedAt,
                        :checkedAt
                    )
                    """,
                params
            );
            return ProvenanceWrite.INSERTED;
        } catch (DataIntegrityViolationException e) {
            log.debug("Provenance for club {} from {} inserted concurrently, retrying as update", clubId, sourceName);
            return jdbc.update(update, params) > 0 ? ProvenanceWrite.UPDATED : ProvenanceWrite.SUPERSEDED;
        }
    }

    public List<StaleProductSource> findStaleProductSources(String sourceName, Instant checkedBefore, int limit) {
        int safeLimit = Math.max(1, limit);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceName", sourceName)
            .addValue("checkedBefore", toTimestamp(checkedBefore))
            .addValue("limit", safeLimit);
        return jdbc.query(
            """
                SELECT ps.id,
                       ps.golf_club_id,
                       ps.source_name,
                       ps.product_url,
                       ps.price,
                       ps.last_checked,
                       b.name AS brand_name,
                       gc.model_name
                FROM product_sources ps
                JOIN golf_clubs gc ON gc.id = ps.golf_club_id
                JOIN brands b ON b.id = gc.brand_id
                WHERE ps.source_name = :sourceName
                  AND ps.product_url IS NOT NULL
                  AND ps.last_checked < :checkedBefore
                ORDER BY ps.last_checked ASC, ps.id ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new StaleProductSource(
                rs.getLong("id"),
                rs.getLong("golf_club_id"),
                rs.getString("source_name"),
                rs.getString("product_url"),
                rs.getBigDecimal("price"),
                toInstant(rs.getTimestamp("last_checked")),
                rs.getString("brand_name"),
                rs.getString("model_name")
            )
        );
    }

    // scrape runs

    public long insertScrapeRun(String sourceName, String scrapeType, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceName", sourceName)
            .addValue("scrapeType", scrapeType)
            .addValue("status", ScrapeRunStatus.RUNNING.dbValue())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (
                    source_name,
                    scrape_type,
                    status,
                    started_at
                )
                VALUES (
                    :sourceName,
                    :scrapeType,
                    :status,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scrape run for " + sourceName);
        }
        return key.longValue();
    }

    /**
     * Finalizes a run. Only rows still {@code running} match, so a finished run is never rewritten.
     */
    public boolean completeScrapeRun(
        long runId,
        ScrapeRunStatus status,
        int recordsAdded,
        int recordsUpdated,
        int errorCount,
        int skippedCount,
        String errorMessage,
        Instant completedAt
    ) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Scrape run must finish in a terminal status, got " + status);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", status.dbValue())
            .addValue("running", ScrapeRunStatus.RUNNING.dbValue())
            .addValue("recordsAdded", Math.max(0, recordsAdded))
            .addValue("recordsUpdated", Math.max(0, recordsUpdated))
            .addValue("errorCount", Math.max(0, errorCount))
            .addValue("skippedCount", Math.max(0, skippedCount))
            .addValue("errorMessage", truncateErrorDetail(errorMessage))
            .addValue("completedAt", toTimestamp(completedAt));
        int updated = jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :status,
                    records_added = :recordsAdded,
                    records_updated = :recordsUpdated,
                    error_count = :errorCount,
                    skipped_count = :skippedCount,
                    error_message = :errorMessage,
                    completed_at = :completedAt
                WHERE id = :runId
                  AND status = :running
                """,
            params
        );
        return updated > 0;
    }

    public int failStaleRunningRuns(Instant startedBefore, String errorMessage, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("failed", ScrapeRunStatus.FAILED.dbValue())
            .addValue("running", ScrapeRunStatus.RUNNING.dbValue())
            .addValue("errorMessage", truncateErrorDetail(errorMessage))
            .addValue("startedBefore", toTimestamp(startedBefore))
            .addValue("completedAt", toTimestamp(completedAt));
        return jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :failed,
                    error_message = :errorMessage,
                    completed_at = :completedAt
                WHERE status = :running
                  AND started_at < :startedBefore
                """,
            params
        );
    }

    public ScrapeRun findScrapeRun(long runId) {
        List<ScrapeRun> rows = jdbc.query(
            SCRAPE_RUN_SELECT + " WHERE id = :runId",
            new MapSqlParameterSource().addValue("runId", runId),
            scrapeRunRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ScrapeRun> findRecentScrapeRuns(String sourceName, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceName", sourceName, Types.VARCHAR)
            .addValue("limit", Math.max(1, Math.min(limit, 500)));
        return jdbc.query(
            SCRAPE_RUN_SELECT + """
                 WHERE (CAST(:sourceName AS VARCHAR(100)) IS NULL OR source_name = :sourceName)
                 ORDER BY started_at DESC, id DESC
                 LIMIT :limit
                """,
            params,
            scrapeRunRowMapper()
        );
    }

    public List<ScrapeRun> findRunningScrapeRuns(String sourceName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceName", sourceName, Types.VARCHAR)
            .addValue("running", ScrapeRunStatus.RUNNING.dbValue());
        return jdbc.query(
            SCRAPE_RUN_SELECT + """
                 WHERE status = :running
                   AND (CAST(:sourceName AS VARCHAR(100)) IS NULL OR source_name = :sourceName)
                 ORDER BY started_at ASC
                """,
            params,
            scrapeRunRowMapper()
        );
    }

    private RowMapper<CanonicalClub> clubRowMapper() {
        return (rs, rowNum) -> {
            long clubTypeId = rs.getLong("club_type_id");
            Long clubTypeRef = rs.wasNull() ? null : clubTypeId;
            return new CanonicalClub(
                rs.getLong("id"),
                rs.getLong("brand_id"),
                rs.getString("brand_name"),
                clubTypeRef,
                rs.getString("club_type_name"),
                rs.getString("model_name"),
                rs.getInt("year_released"),
                rs.getBigDecimal("msrp"),
                rs.getBigDecimal("current_price"),
                rs.getBoolean("is_current"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))
            );
        };
    }

    private RowMapper<ScrapeRun> scrapeRunRowMapper() {
        return (rs, rowNum) -> new ScrapeRun(
            rs.getLong("id"),
            rs.getString("source_name"),
            rs.getString("scrape_type"),
            ScrapeRunStatus.fromDbValue(rs.getString("status")),
            rs.getInt("records_added"),
            rs.getInt("records_updated"),
            rs.getInt("error_count"),
            rs.getInt("skipped_count"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    static String brandKey(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncateErrorDetail(String detail) {
        if (detail == null) {
            return null;
        }
        String trimmed = detail.trim();
        if (trimmed.length() <= MAX_ERROR_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_LENGTH);
    }

    public enum ProvenanceWrite {
        INSERTED,
        UPDATED,
        SUPERSEDED
    }

    public record ClubInsertResult(CanonicalClub club, boolean created) {}
}
