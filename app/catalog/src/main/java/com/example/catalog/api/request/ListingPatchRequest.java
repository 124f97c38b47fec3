package com.example.catalog.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListingPatchRequest(
    @Size(min = 1, max = 200) String name,
    String description,
    @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal price,
    @Size(min = 3, max = 3) String currency) {}
