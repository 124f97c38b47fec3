package com.example.catalog.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/** {@code confirmed=false} discards the draft together with its image. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfirmListingRequest(@NotNull UUID listingId, @NotNull Boolean confirmed) {}
