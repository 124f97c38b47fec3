package com.example.catalog.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InterestRequest(
    @NotNull UUID listingId,
    @Size(max = 100) String buyerName,
    @Size(max = 20) String buyerPhone) {}
