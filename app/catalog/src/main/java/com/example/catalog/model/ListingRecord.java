/*
 * Where: app/catalog/src/main/java/com/example/catalog/model/ListingRecord.java
 * What: row of the listings table
 * Why: removedAt and undoDeadline are present exactly when the state is REMOVED
 */
package com.example.catalog.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record ListingRecord(
    UUID listingId,
    UUID sellerId,
    String name,
    String description,
    BigDecimal price,
    String currency,
    String imageUrl,
    String imagePath,
    ListingState state,
    Instant removedAt,
    Instant undoDeadline,
    Instant createdAt,
    Instant updatedAt) {

  /** Largest price the NUMERIC(12, 2) price column holds. */
  public static final BigDecimal MAX_PRICE = new BigDecimal("9999999999.99");

  public static boolean priceInRange(BigDecimal price) {
    return price.signum() >= 0 && price.compareTo(MAX_PRICE) <= 0;
  }

  public ListingRecord withState(
      ListingState newState, Instant newRemovedAt, Instant newUndoDeadline, Instant now) {
    return new ListingRecord(
        listingId,
        sellerId,
        name,
        description,
        price,
        currency,
        imageUrl,
        imagePath,
        newState,
        newRemovedAt,
        newUndoDeadline,
        createdAt,
        now);
  }
}
