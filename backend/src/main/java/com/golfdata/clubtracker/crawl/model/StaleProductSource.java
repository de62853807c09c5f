package com.golfdata.clubtracker.crawl.model;

import java.math.BigDecimal;
import java.time.Instant;

public record StaleProductSource(
    long productSourceId,
    long clubId,
    String sourceName,
    String productUrl,
    BigDecimal price,
    Instant lastChecked,
    String brandName,
    String modelName
) {}
