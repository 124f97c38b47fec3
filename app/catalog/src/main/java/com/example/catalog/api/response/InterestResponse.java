package com.example.catalog.api.response;

import com.example.catalog.service.InterestResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InterestResponse(
    UUID id, UUID listingId, String buyerName, boolean messageSent, Instant createdAt, String chatLink) {

  public static InterestResponse from(InterestResult result) {
    return new InterestResponse(
        result.interest().interestId(),
        result.interest().listingId(),
        result.interest().buyerName(),
        result.interest().messageSent(),
        result.interest().createdAt(),
        result.chatLink());
  }
}
