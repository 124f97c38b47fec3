package com.example.catalog.api.response;

import com.example.catalog.service.CatalogView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogResponse(
    String catalogSlug, String sellerName, int listingCount, List<CatalogListingResponse> listings) {

  public CatalogResponse {
    listings = List.copyOf(listings);
  }

  public static CatalogResponse from(CatalogView view) {
    final List<CatalogListingResponse> listings =
        view.items().stream().map(CatalogListingResponse::from).toList();
    return new CatalogResponse(
        view.seller().catalogSlug(), view.seller().displayName(), listings.size(), listings);
  }
}
