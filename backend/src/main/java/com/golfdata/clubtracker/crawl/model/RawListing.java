package com.golfdata.clubtracker.crawl.model;

import java.math.BigDecimal;

/**
 * A normalized listing as extracted from one retailer page. Never persisted directly.
 */
public record RawListing(
    String source,
    String brandText,
    String modelText,
    String clubType,
    BigDecimal price,
    String detailUrl,
    boolean inStock,
    Integer modelYear,
    BigDecimal listPrice
) {
    public RawListing(
        String source,
        String brandText,
        String modelText,
        String clubType,
        BigDecimal price,
        String detailUrl,
        boolean inStock
    ) {
        this(source, brandText, modelText, clubType, price, detailUrl, inStock, null, null);
    }

    public RawListing withDetail(RawListing detail) {
        if (detail == null) {
            return this;
        }
        return new RawListing(
            source,
            brandText,
            modelText,
            clubType != null ? clubType : detail.clubType(),
            detail.price() != null ? detail.price() : price,
            detailUrl != null ? detailUrl : detail.detailUrl(),
            detail.inStock(),
            detail.modelYear() != null ? detail.modelYear() : modelYear,
            detail.listPrice() != null ? detail.listPrice() : listPrice
        );
    }
}
