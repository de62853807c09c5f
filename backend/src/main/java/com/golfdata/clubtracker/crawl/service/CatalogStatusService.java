package com.golfdata.clubtracker.crawl.service;

import com.golfdata.clubtracker.crawl.model.CatalogStatusResponse;
import com.golfdata.clubtracker.crawl.model.ScrapeRun;
import com.golfdata.clubtracker.crawl.persistence.CatalogJdbcRepository;
import com.golfdata.clubtracker.crawl.source.SourceAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class CatalogStatusService {
    private static final Logger log = LoggerFactory.getLogger(CatalogStatusService.class);

    private final CatalogJdbcRepository repository;
    private final SourceAdapterRegistry registry;

    public CatalogStatusService(CatalogJdbcRepository repository, SourceAdapterRegistry registry) {
        this.repository = repository;
        this.registry = registry;
    }

    public CatalogStatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Catalog database unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new CatalogStatusResponse(false, new LinkedHashMap<>(), registry.keys());
        }
        return new CatalogStatusResponse(true, repository.tableCounts(), registry.keys());
    }

    public List<ScrapeRun> getRecentRuns(String sourceName, Integer limit) {
        int safeLimit = limit == null ? 20 : Math.max(1, Math.min(limit, 500));
        String source = sourceName == null || sourceName.isBlank() ? null : sourceName.trim();
        return repository.findRecentScrapeRuns(source, safeLimit);
    }

    public ScrapeRun getRun(long runId) {
        ScrapeRun run = repository.findScrapeRun(runId);
        if (run == null) {
            throw new ResponseStatusException(NOT_FOUND, "Scrape run not found: " + runId);
        }
        return run;
    }
}
