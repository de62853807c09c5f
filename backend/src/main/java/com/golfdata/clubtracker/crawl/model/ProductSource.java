package com.golfdata.clubtracker.crawl.model;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductSource(
    long id,
    long clubId,
    String sourceName,
    String productUrl,
    BigDecimal price,
    boolean inStock,
    Instant lastChecked
) {}
