package com.example.catalog.service;

import com.example.catalog.model.ListingRecord;
import java.time.Instant;
import java.util.List;

/** Listings moved to REMOVED by one batch and the undo deadline they share. */
public record RemovalResult(List<ListingRecord> removed, Instant undoDeadline) {

  public RemovalResult {
    removed = List.copyOf(removed);
  }

  public int removedCount() {
    return removed.size();
  }
}
