package com.example.catalog.api;

import com.example.catalog.api.request.ConfirmListingRequest;
import com.example.catalog.api.request.ListingPatchRequest;
import com.example.catalog.api.request.RemoveListingsRequest;
import com.example.catalog.api.request.RestoreListingRequest;
import com.example.catalog.api.response.ListingResponse;
import com.example.catalog.api.response.RemoveListingsResponse;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.service.DownloadedImage;
import com.example.catalog.service.ListingLifecycleService;
import com.example.catalog.service.ListingService;
import com.example.catalog.service.SellerService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/listings")
@RequiredArgsConstructor
public class ListingController {

  private final ListingService listingService;
  private final ListingLifecycleService lifecycleService;
  private final SellerService sellerService;

  @GetMapping("/seller/{sellerId}")
  public ResponseEntity<List<ListingResponse>> listBySeller(
      @PathVariable("sellerId") UUID sellerId,
      @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive) {
    return ResponseEntity.ok(
        listingService.listBySeller(sellerId, includeInactive).stream()
            .map(ListingResponse::from)
            .toList());
  }

  @GetMapping("/{listingId}")
  public ResponseEntity<ListingResponse> get(@PathVariable("listingId") UUID listingId) {
    return ResponseEntity.ok(ListingResponse.from(listingService.get(listingId)));
  }

  @PatchMapping("/{listingId}")
  public ResponseEntity<ListingResponse> patch(
      @PathVariable("listingId") UUID listingId, @Valid @RequestBody ListingPatchRequest request) {
    return ResponseEntity.ok(
        ListingResponse.from(
            listingService.update(
                listingId,
                request.name(),
                request.description(),
                request.price(),
                request.currency())));
  }

  /**
   * Seller-app upload. The caption is parsed like a photo caption and the listing stays a DRAFT
   * until {@code /listings/confirm}.
   */
  @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ListingResponse> upload(
      @RequestParam("seller_id") UUID sellerId,
      @RequestParam(name = "caption", required = false) String caption,
      @RequestPart("image") MultipartFile image)
      throws IOException {
    final SellerRecord seller = sellerService.get(sellerId);
    final ListingRecord draft =
        lifecycleService.intakeImage(
            seller, new DownloadedImage(image.getBytes(), image.getContentType()), caption);
    return ResponseEntity.status(HttpStatus.CREATED).body(ListingResponse.from(draft));
  }

  @PostMapping("/confirm")
  public ResponseEntity<ListingResponse> confirm(
      @Valid @RequestBody ConfirmListingRequest request) {
    final ListingRecord decided =
        request.confirmed()
            ? lifecycleService.confirm(request.listingId())
            : lifecycleService.cancel(request.listingId());
    return ResponseEntity.ok(ListingResponse.from(decided));
  }

  /** Soft-removes the ACTIVE listings among the ids; the rest are skipped. */
  @PostMapping("/remove")
  public ResponseEntity<RemoveListingsResponse> remove(
      @Valid @RequestBody RemoveListingsRequest request) {
    return ResponseEntity.ok(
        RemoveListingsResponse.from(lifecycleService.remove(request.listingIds())));
  }

  /** 410 once the undo window has closed. */
  @PostMapping("/restore")
  public ResponseEntity<ListingResponse> restore(
      @Valid @RequestBody RestoreListingRequest request) {
    return ResponseEntity.ok(ListingResponse.from(lifecycleService.restore(request.listingId())));
  }
}
