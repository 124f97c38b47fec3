/*
 * Where: catalog service layer
 * What: buyer-side reads of a seller catalog and interest signals
 * Why: only ACTIVE listings are visible, and every view and interest is audited with network data
 */
package com.example.catalog.service;

import com.example.catalog.config.WhatsAppProperties;
import com.example.catalog.model.AuditAction;
import com.example.catalog.model.InterestRecord;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.NetworkMetadata;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.InterestRepository;
import com.example.catalog.repository.ListingRepository;
import com.example.catalog.repository.SellerRepository;
import com.example.catalog.service.AuditTrailRecorder.AuditEntry;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class CatalogViewService {

  private static final Logger logger = LoggerFactory.getLogger(CatalogViewService.class);
  static final int MAX_BUYER_NAME_LENGTH = 100;
  static final int MAX_BUYER_PHONE_LENGTH = 20;

  private final SellerRepository sellerRepository;
  private final ListingRepository listingRepository;
  private final InterestRepository interestRepository;
  private final AuditTrailRecorder auditTrailRecorder;
  private final NotificationDispatcher notificationDispatcher;
  private final SellerMessages messages;
  private final WhatsAppProperties whatsAppProperties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public CatalogView view(String catalogSlug, NetworkMetadata metadata) {
    final SellerRecord seller = activeSeller(catalogSlug);
    final List<CatalogItem> items =
        listingRepository.findBySeller(seller.sellerId(), false).stream()
            .map(listing -> new CatalogItem(listing, chatLink(seller, listing)))
            .toList();
    auditTrailRecorder.record(
        AuditEntry.of(
                AuditAction.CATALOG_VIEWED,
                Map.of("catalog_slug", catalogSlug, "listing_count", items.size()))
            .seller(seller.sellerId())
            .network(metadata));
    return new CatalogView(seller, items);
  }

  public CatalogItem listing(String catalogSlug, UUID listingId) {
    final SellerRecord seller = activeSeller(catalogSlug);
    final ListingRecord listing =
        listingRepository
            .findActiveBySellerAndId(seller.sellerId(), listingId)
            .orElseThrow(() -> listingNotAvailable(listingId));
    return new CatalogItem(listing, chatLink(seller, listing));
  }

  /**
   * Records a buyer's interest in an ACTIVE listing and notifies the seller. A failed
   * notification is stored on the interest, it does not fail the call.
   */
  public InterestResult signalInterest(
      String catalogSlug,
      UUID listingId,
      String buyerName,
      String buyerPhone,
      NetworkMetadata metadata) {
    validateBuyer(buyerName, buyerPhone);
    final SellerRecord seller = activeSeller(catalogSlug);
    final NetworkMetadata network = metadata == null ? NetworkMetadata.NONE : metadata;
    final Instant now = Instant.now(clock);
    final InterestContext context =
        transactionTemplate.execute(
            status -> {
              final ListingRecord listing =
                  listingRepository
                      .findByIdForUpdate(listingId)
                      .filter(row -> row.sellerId().equals(seller.sellerId()))
                      .filter(row -> row.state() == ListingState.ACTIVE)
                      .orElseThrow(() -> listingNotAvailable(listingId));
              final InterestRecord interest =
                  interestRepository.insert(
                      new InterestRecord(
                          UUID.randomUUID(),
                          listing.listingId(),
                          buyerPhone,
                          buyerName,
                          network.ipAddress(),
                          network.userAgent(),
                          false,
                          now));
              return new InterestContext(listing, interest);
            });

    final DeliveryResult delivery =
        notificationDispatcher.dispatch(
            OutboundMessage.text(
                seller.phoneNumber(),
                messages.interestNotification(buyerName, context.listing())),
            seller.sellerId());
    if (delivery.delivered()) {
      interestRepository.markMessageSent(context.interest().interestId(), true);
    }
    final InterestRecord stored =
        new InterestRecord(
            context.interest().interestId(),
            context.interest().listingId(),
            context.interest().buyerPhone(),
            context.interest().buyerName(),
            context.interest().buyerIp(),
            context.interest().userAgent(),
            delivery.delivered(),
            context.interest().createdAt());

    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("listing_name", context.listing().name());
    payload.put("buyer_name", buyerName);
    payload.put("buyer_phone", buyerPhone);
    payload.put("message_sent", delivery.delivered());
    auditTrailRecorder.record(
        AuditEntry.of(AuditAction.INTEREST_SIGNALED, payload)
            .seller(seller.sellerId())
            .listing(listingId)
            .interest(stored.interestId())
            .network(network));
    logger.info(
        "interest signaled listingId={} interestId={} messageSent={}",
        listingId,
        stored.interestId(),
        delivery.delivered());
    return new InterestResult(stored, chatLink(seller, context.listing()));
  }

  /** Pre-filled buyer message: name, price when known, and an availability question. */
  @VisibleForTesting
  static String interestText(ListingRecord listing) {
    final StringBuilder text =
        new StringBuilder("Hi! I'm interested in your product: ").append(listing.name());
    if (listing.price() != null) {
      text.append(" (priced at ").append(SellerMessages.formatPrice(listing.price())).append(')');
    }
    return text.append(". Is it still available?").toString();
  }

  private String chatLink(SellerRecord seller, ListingRecord listing) {
    return PhoneNumbers.chatLink(
        seller.phoneNumber(), interestText(listing), whatsAppProperties.defaultCountryCode());
  }

  private SellerRecord activeSeller(String catalogSlug) {
    return sellerRepository
        .findActiveBySlug(catalogSlug)
        .orElseThrow(
            () ->
                new CatalogException(
                    CatalogException.Reason.NOT_FOUND, "catalog not found: " + catalogSlug));
  }

  private CatalogException listingNotAvailable(UUID listingId) {
    return new CatalogException(
        CatalogException.Reason.NOT_FOUND, "listing not found or no longer available: " + listingId);
  }

  private void validateBuyer(String buyerName, String buyerPhone) {
    if (buyerName != null && buyerName.length() > MAX_BUYER_NAME_LENGTH) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "buyer name is too long");
    }
    if (buyerPhone != null && buyerPhone.length() > MAX_BUYER_PHONE_LENGTH) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "buyer phone is too long");
    }
  }

  private record InterestContext(ListingRecord listing, InterestRecord interest) {}
}
