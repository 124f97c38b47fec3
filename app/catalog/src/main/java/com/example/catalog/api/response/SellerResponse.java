package com.example.catalog.api.response;

import com.example.catalog.model.SellerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SellerResponse(
    UUID id,
    String phoneNumber,
    String displayName,
    String catalogSlug,
    String catalogUrl,
    boolean active,
    Instant createdAt) {

  public static SellerResponse from(SellerRecord seller, String catalogUrl) {
    return new SellerResponse(
        seller.sellerId(),
        seller.phoneNumber(),
        seller.displayName(),
        seller.catalogSlug(),
        catalogUrl,
        seller.active(),
        seller.createdAt());
  }
}
