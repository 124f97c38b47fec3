/*
 * Where: catalog service layer
 * What: get-or-create of a seller keyed by the channel phone number
 * Why: concurrent first contacts from one phone must converge on a single seller and audit record
 */
package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.SellerRepository;
import com.example.catalog.service.AuditTrailRecorder.AuditEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SellerProvisioningService {

  private static final Logger logger = LoggerFactory.getLogger(SellerProvisioningService.class);
  static final int MAX_SLUG_ATTEMPTS = 5;
  static final int MAX_PHONE_NUMBER_LENGTH = 20;

  private final SellerRepository sellerRepository;
  private final CatalogSlugGenerator slugGenerator;
  private final AuditTrailRecorder auditTrailRecorder;
  private final CatalogMetrics metrics;
  private final Clock clock;

  /**
   * Returns the seller owning {@code phoneNumber}, creating it on first contact.
   *
   * <p>Each statement commits on its own: a unique violation inside a surrounding transaction
   * would leave it unusable for the re-read.
   */
  public ProvisionResult getOrCreate(String phoneNumber) {
    return getOrCreate(phoneNumber, null);
  }

  public ProvisionResult getOrCreate(String phoneNumber, String displayName) {
    validatePhoneNumber(phoneNumber);
    final Optional<SellerRecord> existing = sellerRepository.findByPhoneNumber(phoneNumber);
    if (existing.isPresent()) {
      return new ProvisionResult(existing.get(), false);
    }

    for (int attempt = 1; attempt <= MAX_SLUG_ATTEMPTS; attempt++) {
      final String slug = slugGenerator.generate();
      if (sellerRepository.existsBySlug(slug)) {
        logger.debug("catalog slug already taken slug={} attempt={}", slug, attempt);
        continue;
      }
      final Instant now = Instant.now(clock);
      final SellerRecord candidate =
          new SellerRecord(UUID.randomUUID(), phoneNumber, displayName, slug, true, now, now);
      final Optional<SellerRecord> inserted;
      try {
        inserted = sellerRepository.insertIfAbsent(candidate);
      } catch (DuplicateKeyException ex) {
        logger.debug("catalog slug collided on insert slug={} attempt={}", slug, attempt);
        final Optional<SellerRecord> winner = sellerRepository.findByPhoneNumber(phoneNumber);
        if (winner.isPresent()) {
          return new ProvisionResult(winner.get(), false);
        }
        continue;
      }
      if (inserted.isEmpty()) {
        // another writer registered the same phone number first
        final SellerRecord winner =
            sellerRepository
                .findByPhoneNumber(phoneNumber)
                .orElseThrow(
                    () ->
                        new IllegalStateException(
                            "seller vanished after phone number conflict"));
        return new ProvisionResult(winner, false);
      }

      final SellerRecord created = inserted.get();
      auditTrailRecorder.record(
          AuditEntry.of(
                  AuditAction.ACCOUNT_REGISTERED,
                  Map.of("phone_number", phoneNumber, "catalog_slug", created.catalogSlug()))
              .seller(created.sellerId()));
      metrics.recordTransition(AuditAction.ACCOUNT_REGISTERED.name());
      logger.info(
          "seller registered sellerId={} catalogSlug={}",
          created.sellerId(),
          created.catalogSlug());
      return new ProvisionResult(created, true);
    }
    throw new IllegalStateException(
        "catalog slug generation exhausted after " + MAX_SLUG_ATTEMPTS + " attempts");
  }

  private void validatePhoneNumber(String phoneNumber) {
    if (phoneNumber == null || phoneNumber.isBlank()) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "phone number is required");
    }
    if (phoneNumber.length() > MAX_PHONE_NUMBER_LENGTH) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "phone number is too long");
    }
  }
}
