package com.example.catalog.api.response;

import com.example.catalog.model.ListingRecord;
import com.example.catalog.service.RemovalResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RemoveListingsResponse(int removedCount, List<UUID> removedIds, Instant undoDeadline) {

  public RemoveListingsResponse {
    removedIds = List.copyOf(removedIds);
  }

  public static RemoveListingsResponse from(RemovalResult result) {
    return new RemoveListingsResponse(
        result.removedCount(),
        result.removed().stream().map(ListingRecord::listingId).toList(),
        result.undoDeadline());
  }
}
