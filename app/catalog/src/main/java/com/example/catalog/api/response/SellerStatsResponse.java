package com.example.catalog.api.response;

import com.example.catalog.service.SellerStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SellerStatsResponse(
    UUID sellerId,
    int totalListings,
    int activeListings,
    int draftListings,
    int removedListings,
    int totalInterests,
    int interestsLast7Days,
    int catalogViews) {

  public static SellerStatsResponse from(SellerStats stats) {
    return new SellerStatsResponse(
        stats.sellerId(),
        stats.totalListings(),
        stats.activeListings(),
        stats.draftListings(),
        stats.removedListings(),
        stats.totalInterests(),
        stats.interestsLast7Days(),
        stats.catalogViews());
  }
}
