package com.example.catalog.service;

import com.example.catalog.config.WhatsAppProperties;
import com.example.catalog.model.AuditAction;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.AuditRecordRepository;
import com.example.catalog.repository.InterestRepository;
import com.example.catalog.repository.ListingRepository;
import com.example.catalog.repository.SellerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Seller profile operations behind the seller-app API. */
@Service
@RequiredArgsConstructor
public class SellerService {

  static final int MAX_DISPLAY_NAME_LENGTH = 100;
  private static final Duration RECENT_INTEREST_WINDOW = Duration.ofDays(7);

  private final SellerProvisioningService provisioningService;
  private final SellerRepository sellerRepository;
  private final ListingRepository listingRepository;
  private final InterestRepository interestRepository;
  private final AuditRecordRepository auditRecordRepository;
  private final WhatsAppProperties whatsAppProperties;
  private final Clock clock;

  /** Idempotent: an already registered phone number returns the existing seller. */
  public ProvisionResult register(String phoneNumber, String displayName) {
    validateDisplayName(displayName);
    return provisioningService.getOrCreate(normalize(phoneNumber), displayName);
  }

  public SellerRecord getByPhoneNumber(String phoneNumber) {
    return sellerRepository
        .findByPhoneNumber(normalize(phoneNumber))
        .orElseThrow(() -> notFound("seller not found for phone number"));
  }

  public SellerRecord get(UUID sellerId) {
    return sellerRepository
        .findById(sellerId)
        .orElseThrow(() -> notFound("seller not found: " + sellerId));
  }

  public SellerRecord update(UUID sellerId, String displayName, Boolean active) {
    validateDisplayName(displayName);
    return sellerRepository
        .updateProfile(sellerId, displayName, active, Instant.now(clock))
        .orElseThrow(() -> notFound("seller not found: " + sellerId));
  }

  public SellerStats stats(UUID sellerId) {
    get(sellerId);
    final int active = listingRepository.countBySellerAndState(sellerId, ListingState.ACTIVE);
    final int drafts = listingRepository.countBySellerAndState(sellerId, ListingState.DRAFT);
    final int removed = listingRepository.countBySellerAndState(sellerId, ListingState.REMOVED);
    final Instant recentSince = Instant.now(clock).minus(RECENT_INTEREST_WINDOW);
    return new SellerStats(
        sellerId,
        active + drafts + removed,
        active,
        drafts,
        removed,
        interestRepository.countBySeller(sellerId, null),
        interestRepository.countBySeller(sellerId, recentSince),
        auditRecordRepository.countBySellerAndAction(sellerId, AuditAction.CATALOG_VIEWED));
  }

  private String normalize(String phoneNumber) {
    final String normalized =
        PhoneNumbers.normalize(phoneNumber, whatsAppProperties.defaultCountryCode());
    if (normalized.isEmpty()) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "phone number is required");
    }
    return normalized;
  }

  private void validateDisplayName(String displayName) {
    if (displayName != null && displayName.length() > MAX_DISPLAY_NAME_LENGTH) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT, "display name is too long");
    }
  }

  private CatalogException notFound(String message) {
    return new CatalogException(CatalogException.Reason.NOT_FOUND, message);
  }
}
