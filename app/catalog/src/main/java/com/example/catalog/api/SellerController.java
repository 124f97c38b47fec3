package com.example.catalog.api;

import com.example.catalog.api.request.RegisterSellerRequest;
import com.example.catalog.api.request.SellerPatchRequest;
import com.example.catalog.api.response.CatalogLinkResponse;
import com.example.catalog.api.response.SellerResponse;
import com.example.catalog.api.response.SellerStatsResponse;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.service.ProvisionResult;
import com.example.catalog.service.SellerMessages;
import com.example.catalog.service.SellerService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sellers")
@RequiredArgsConstructor
public class SellerController {

  private final SellerService sellerService;
  private final SellerMessages messages;

  /** 201 when the seller was created, 200 when the phone number was already registered. */
  @PostMapping("/register")
  public ResponseEntity<SellerResponse> register(
      @Valid @RequestBody RegisterSellerRequest request) {
    final ProvisionResult result =
        sellerService.register(request.phoneNumber(), request.displayName());
    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
        .body(toResponse(result.seller()));
  }

  @GetMapping("/phone/{phoneNumber}")
  public ResponseEntity<SellerResponse> getByPhoneNumber(
      @PathVariable("phoneNumber") String phoneNumber) {
    return ResponseEntity.ok(toResponse(sellerService.getByPhoneNumber(phoneNumber)));
  }

  @GetMapping("/{sellerId}")
  public ResponseEntity<SellerResponse> get(@PathVariable("sellerId") UUID sellerId) {
    return ResponseEntity.ok(toResponse(sellerService.get(sellerId)));
  }

  @PatchMapping("/{sellerId}")
  public ResponseEntity<SellerResponse> patch(
      @PathVariable("sellerId") UUID sellerId, @Valid @RequestBody SellerPatchRequest request) {
    return ResponseEntity.ok(
        toResponse(sellerService.update(sellerId, request.displayName(), request.active())));
  }

  @GetMapping("/{sellerId}/catalog-link")
  public ResponseEntity<CatalogLinkResponse> catalogLink(@PathVariable("sellerId") UUID sellerId) {
    final SellerRecord seller = sellerService.get(sellerId);
    return ResponseEntity.ok(
        new CatalogLinkResponse(seller.catalogSlug(), messages.catalogUrl(seller)));
  }

  @GetMapping("/{sellerId}/stats")
  public ResponseEntity<SellerStatsResponse> stats(@PathVariable("sellerId") UUID sellerId) {
    return ResponseEntity.ok(SellerStatsResponse.from(sellerService.stats(sellerId)));
  }

  private SellerResponse toResponse(SellerRecord seller) {
    return SellerResponse.from(seller, messages.catalogUrl(seller));
  }
}
