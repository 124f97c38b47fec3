package com.example.catalog.api.response;

import com.example.catalog.service.CatalogItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogListingResponse(
    UUID id,
    String name,
    String description,
    BigDecimal price,
    String currency,
    String imageUrl,
    String chatLink,
    Instant createdAt) {

  public static CatalogListingResponse from(CatalogItem item) {
    return new CatalogListingResponse(
        item.listing().listingId(),
        item.listing().name(),
        item.listing().description(),
        item.listing().price(),
        item.listing().currency(),
        item.listing().imageUrl(),
        item.chatLink(),
        item.listing().createdAt());
  }
}
