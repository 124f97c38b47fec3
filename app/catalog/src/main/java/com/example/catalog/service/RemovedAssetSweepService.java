/*
 * Where: catalog service layer
 * What: deletes image assets of REMOVED listings whose undo window closed long ago
 * Why: removed listings otherwise keep their image forever; the listing state is left untouched
 */
package com.example.catalog.service;

import com.example.catalog.config.RemovalSweepProperties;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.repository.ListingRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RemovedAssetSweepService {

  private static final Logger logger = LoggerFactory.getLogger(RemovedAssetSweepService.class);

  private final ListingRepository listingRepository;
  private final ImageAssetStore assetStore;
  private final RemovalSweepProperties properties;
  private final Clock clock;

  /** Returns the number of listings marked as reclaimed. */
  public int sweep() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(properties.grace());
    final List<ListingRecord> candidates =
        listingRepository.findReclaimableRemoved(threshold, properties.batchSize());
    int reclaimed = 0;
    for (ListingRecord listing : candidates) {
      if (!assetStore.delete(listing.imagePath())) {
        // already gone or not deletable; marking stops the sweep from retrying forever
        logger.warn(
            "removed listing asset not deleted listingId={} path={}",
            listing.listingId(),
            listing.imagePath());
      }
      reclaimed += listingRepository.markAssetReclaimed(listing.listingId(), now);
    }
    logger.info(
        "removed asset sweep reclaimed={} candidates={} threshold={}",
        reclaimed,
        candidates.size(),
        threshold);
    return reclaimed;
  }
}
