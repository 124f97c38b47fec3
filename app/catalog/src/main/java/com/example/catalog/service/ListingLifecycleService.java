/*
 * Where: catalog service layer
 * What: drives listings through DRAFT, ACTIVE and REMOVED and out of existence
 * Why: each transition must be atomic with its audit record and race-free across channels
 */
package com.example.catalog.service;

import com.example.catalog.config.ListingProperties;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.ListingRepository;
import com.example.catalog.service.AuditTrailRecorder.AuditEntry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ListingLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(ListingLifecycleService.class);

  private final ListingRepository listingRepository;
  private final AuditTrailRecorder auditTrailRecorder;
  private final MediaResolver mediaResolver;
  private final ImageAssetStore assetStore;
  private final ImageUploadValidator uploadValidator;
  private final CaptionParser captionParser;
  private final ListingProperties properties;
  private final CatalogMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  /** Fetches the referenced image and records a DRAFT listing for it. */
  public ListingRecord intake(SellerRecord seller, String mediaId, String caption) {
    if (mediaId == null || mediaId.isBlank()) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "media id is required");
    }
    final DownloadedImage image;
    try {
      final String mediaUrl =
          mediaResolver
              .resolveMediaUrl(mediaId)
              .orElseThrow(
                  () ->
                      new CatalogException(
                          CatalogException.Reason.UPSTREAM_FAILURE,
                          "no download url for media " + mediaId));
      image = mediaResolver.download(mediaUrl);
    } catch (WhatsAppIntegrationException ex) {
      if (ex.reason() == WhatsAppIntegrationException.Reason.PAYLOAD_TOO_LARGE) {
        throw new CatalogException(CatalogException.Reason.INVALID_INPUT, ex.getMessage(), ex);
      }
      throw new CatalogException(
          CatalogException.Reason.UPSTREAM_FAILURE,
          "media " + mediaId + " could not be fetched: " + ex.reason(),
          ex);
    }
    return intakeImage(seller, image, caption);
  }

  /** Validates and stores an already fetched image, then records a DRAFT listing for it. */
  public ListingRecord intakeImage(SellerRecord seller, DownloadedImage image, String caption) {
    uploadValidator.validate(image);
    final ParsedCaption parsed = captionParser.parse(caption);
    final StoredAsset asset = assetStore.store(image);
    final Instant now = Instant.now(clock);
    final ListingRecord draft =
        new ListingRecord(
            UUID.randomUUID(),
            seller.sellerId(),
            parsed.name(),
            parsed.description(),
            parsed.price(),
            properties.defaultCurrency(),
            asset.publicUrl(),
            asset.storagePath(),
            ListingState.DRAFT,
            null,
            null,
            now,
            now);
    try {
      final ListingRecord inserted =
          transactionTemplate.execute(
              status -> {
                final ListingRecord row = listingRepository.insert(draft);
                recordAudit(ListingTransitions.upload(row));
                return row;
              });
      logger.info(
          "listing drafted listingId={} sellerId={} price={}",
          inserted.listingId(),
          seller.sellerId(),
          inserted.price());
      return inserted;
    } catch (RuntimeException ex) {
      assetStore.delete(asset.storagePath());
      throw ex;
    }
  }

  public ListingRecord confirm(UUID listingId) {
    return decideDraft(listingId, null, ListingTransitions::confirm);
  }

  /** Confirms on behalf of {@code sellerId}; another seller's listing is reported as not found. */
  public ListingRecord confirm(UUID listingId, UUID sellerId) {
    return decideDraft(listingId, sellerId, ListingTransitions::confirm);
  }

  public ListingRecord cancel(UUID listingId) {
    return decideDraft(listingId, null, ListingTransitions::cancel);
  }

  public ListingRecord cancel(UUID listingId, UUID sellerId) {
    return decideDraft(listingId, sellerId, ListingTransitions::cancel);
  }

  /**
   * Moves every ACTIVE listing among {@code listingIds} to REMOVED in one transaction. Other
   * states and unknown ids are skipped.
   */
  public RemovalResult remove(Collection<UUID> listingIds) {
    if (listingIds == null || listingIds.contains(null)) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT, "listing ids must not be null");
    }
    final Set<UUID> distinctIds = new LinkedHashSet<>(listingIds);
    final Instant now = Instant.now(clock);
    final Instant undoDeadline = now.plus(properties.undoWindow());
    if (distinctIds.isEmpty()) {
      return new RemovalResult(List.of(), undoDeadline);
    }
    final List<ListingRecord> removed =
        transactionTemplate.execute(
            status -> {
              final List<ListingRecord> changed = new ArrayList<>();
              for (ListingRecord current : listingRepository.findByIdsForUpdate(distinctIds)) {
                if (current.state() != ListingState.ACTIVE) {
                  logger.debug(
                      "listing not removable listingId={} state={}",
                      current.listingId(),
                      current.state());
                  continue;
                }
                final ListingTransition transition =
                    ListingTransitions.remove(current, now, properties.undoWindow());
                applyStateChange(transition);
                changed.add(transition.listing());
              }
              return changed;
            });
    logger.info(
        "listings removed requested={} removed={} undoDeadline={}",
        distinctIds.size(),
        removed.size(),
        undoDeadline);
    return new RemovalResult(removed, undoDeadline);
  }

  /**
   * Returns a REMOVED listing to ACTIVE while its undo window is open.
   *
   * @throws CatalogException {@code NOT_FOUND} when the listing is unknown or not removed, {@code
   *     GONE} when the window has closed
   */
  public ListingRecord restore(UUID listingId) {
    final Instant now = Instant.now(clock);
    final ListingRecord restored =
        transactionTemplate.execute(
            status -> {
              final ListingRecord current =
                  listingRepository
                      .findByIdForUpdate(listingId)
                      .filter(listing -> listing.state() == ListingState.REMOVED)
                      .orElseThrow(
                          () ->
                              new CatalogException(
                                  CatalogException.Reason.NOT_FOUND,
                                  "listing not found or not removed: " + listingId));
              final ListingTransition transition = ListingTransitions.restore(current, now);
              applyStateChange(transition);
              return transition.listing();
            });
    logger.info("listing restored listingId={}", listingId);
    return restored;
  }

  /** Deletes a listing in any live state. The image asset is deleted after commit. */
  public ListingRecord purge(UUID listingId) {
    final Instant now = Instant.now(clock);
    final ListingTransition transition =
        transactionTemplate.execute(
            status -> {
              final ListingRecord current = lockExisting(listingId, null);
              final ListingTransition purge = ListingTransitions.purge(current, now);
              applyDeletion(purge);
              return purge;
            });
    deleteAsset(transition.listing());
    logger.info("listing purged listingId={} fromState={}", listingId, transition.from());
    return transition.listing();
  }

  private ListingRecord decideDraft(
      UUID listingId,
      UUID sellerId,
      BiFunction<ListingRecord, Instant, ListingTransition> decision) {
    final Instant now = Instant.now(clock);
    final ListingTransition transition =
        transactionTemplate.execute(
            status -> {
              final ListingRecord current = lockExisting(listingId, sellerId);
              final ListingTransition next = decision.apply(current, now);
              if (next.listing().state().isTerminal()) {
                applyDeletion(next);
              } else {
                applyStateChange(next);
              }
              return next;
            });
    if (transition.listing().state().isTerminal()) {
      deleteAsset(transition.listing());
    }
    logger.info(
        "draft decided listingId={} action={}", listingId, transition.auditAction());
    return transition.listing();
  }

  private ListingRecord lockExisting(UUID listingId, UUID sellerId) {
    if (listingId == null) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "listing id is required");
    }
    return listingRepository
        .findByIdForUpdate(listingId)
        .filter(listing -> sellerId == null || sellerId.equals(listing.sellerId()))
        .orElseThrow(
            () ->
                new CatalogException(
                    CatalogException.Reason.NOT_FOUND, "listing not found: " + listingId));
  }

  private void applyStateChange(ListingTransition transition) {
    final int updated = listingRepository.updateState(transition.listing(), transition.from());
    if (updated != 1) {
      throw new CatalogException(
          CatalogException.Reason.CONFLICT,
          "listing " + transition.listing().listingId() + " changed concurrently");
    }
    recordAudit(transition);
  }

  private void applyDeletion(ListingTransition transition) {
    final int deleted = listingRepository.delete(transition.listing().listingId());
    if (deleted != 1) {
      throw new CatalogException(
          CatalogException.Reason.NOT_FOUND,
          "listing not found: " + transition.listing().listingId());
    }
    recordAudit(transition);
  }

  private void recordAudit(ListingTransition transition) {
    final ListingRecord listing = transition.listing();
    auditTrailRecorder.record(
        AuditEntry.of(transition.auditAction(), transition.auditPayload())
            .seller(listing.sellerId())
            .listing(listing.listingId()));
    metrics.recordTransition(transition.auditAction().name());
  }

  private void deleteAsset(ListingRecord listing) {
    if (!assetStore.delete(listing.imagePath())) {
      logger.warn(
          "asset not deleted listingId={} path={}", listing.listingId(), listing.imagePath());
    }
  }
}
