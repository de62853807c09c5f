package com.golfdata.clubtracker.crawl.model;

import java.util.List;
import java.util.Map;

public record CatalogStatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    List<String> sources
) {}
