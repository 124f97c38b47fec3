package com.example.catalog.api;

import com.example.catalog.api.response.AuditRecordResponse;
import com.example.catalog.api.response.ListingResponse;
import com.example.catalog.model.AuditAction;
import com.example.catalog.repository.AuditRecordRepository;
import com.example.catalog.service.ListingLifecycleService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

  static final int MAX_AUDIT_LIMIT = 500;

  private final ListingLifecycleService lifecycleService;
  private final AuditRecordRepository auditRecordRepository;

  @DeleteMapping("/listings/{listingId}")
  public ResponseEntity<ListingResponse> purge(@PathVariable("listingId") UUID listingId) {
    return ResponseEntity.ok(ListingResponse.from(lifecycleService.purge(listingId)));
  }

  /** Audit trail lookup for dispute resolution, newest first. */
  @GetMapping("/audit")
  public ResponseEntity<List<AuditRecordResponse>> audit(
      @RequestParam(name = "sellerId", required = false) UUID sellerId,
      @RequestParam(name = "listingId", required = false) UUID listingId,
      @RequestParam(name = "action", required = false) AuditAction action,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    if (limit < 1 || limit > MAX_AUDIT_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_AUDIT_LIMIT);
    }
    return ResponseEntity.ok(
        auditRecordRepository.find(sellerId, listingId, action, limit).stream()
            .map(AuditRecordResponse::from)
            .toList());
  }
}
