package com.example.catalog.api;

import com.example.catalog.api.request.InterestRequest;
import com.example.catalog.api.response.CatalogListingResponse;
import com.example.catalog.api.response.CatalogResponse;
import com.example.catalog.api.response.InterestResponse;
import com.example.catalog.config.ClientAddresses;
import com.example.catalog.service.CatalogViewService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public, read-mostly data behind a seller's shareable catalog page. */
@RestController
@RequestMapping("/catalog")
@RequiredArgsConstructor
public class CatalogController {

  private final CatalogViewService catalogViewService;

  @GetMapping("/{catalogSlug}")
  public ResponseEntity<CatalogResponse> view(
      @PathVariable("catalogSlug") String catalogSlug, HttpServletRequest request) {
    return ResponseEntity.ok(
        CatalogResponse.from(
            catalogViewService.view(catalogSlug, ClientAddresses.networkMetadata(request))));
  }

  @GetMapping("/{catalogSlug}/listings/{listingId}")
  public ResponseEntity<CatalogListingResponse> listing(
      @PathVariable("catalogSlug") String catalogSlug,
      @PathVariable("listingId") UUID listingId) {
    return ResponseEntity.ok(
        CatalogListingResponse.from(catalogViewService.listing(catalogSlug, listingId)));
  }

  @PostMapping("/{catalogSlug}/interest")
  public ResponseEntity<InterestResponse> interest(
      @PathVariable("catalogSlug") String catalogSlug,
      @Valid @RequestBody InterestRequest body,
      HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            InterestResponse.from(
                catalogViewService.signalInterest(
                    catalogSlug,
                    body.listingId(),
                    body.buyerName(),
                    body.buyerPhone(),
                    ClientAddresses.networkMetadata(request))));
  }
}
