package com.golfdata.clubtracker.crawl.model;

import java.math.BigDecimal;
import java.time.Instant;

public record CanonicalClub(
    long id,
    long brandId,
    String brand,
    Long clubTypeId,
    String clubType,
    String modelName,
    int yearReleased,
    BigDecimal msrp,
    BigDecimal currentPrice,
    boolean isCurrent,
    Instant createdAt,
    Instant updatedAt
) {}
