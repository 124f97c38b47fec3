package com.example.catalog.api.response;

import com.example.catalog.model.ListingRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListingResponse(
    UUID id,
    UUID sellerId,
    String name,
    String description,
    BigDecimal price,
    String currency,
    String imageUrl,
    String state,
    Instant removedAt,
    Instant undoDeadline,
    Instant createdAt,
    Instant updatedAt) {

  public static ListingResponse from(ListingRecord listing) {
    return new ListingResponse(
        listing.listingId(),
        listing.sellerId(),
        listing.name(),
        listing.description(),
        listing.price(),
        listing.currency(),
        listing.imageUrl(),
        listing.state().name(),
        listing.removedAt(),
        listing.undoDeadline(),
        listing.createdAt(),
        listing.updatedAt());
  }
}
