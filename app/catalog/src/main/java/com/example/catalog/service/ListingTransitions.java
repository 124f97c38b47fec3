/*
 * Where: catalog service layer
 * What: pure transition functions of the listing lifecycle
 * Why: every edge names its audit kind, so an edge without an audit record cannot be expressed
 */
package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

final class ListingTransitions {

  private ListingTransitions() {}

  static ListingTransition upload(ListingRecord draft) {
    requireState(draft, ListingState.DRAFT);
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", draft.name());
    payload.put("image_url", draft.imageUrl());
    if (draft.price() != null) {
      payload.put("price", draft.price().toPlainString());
    }
    return new ListingTransition(null, draft, AuditAction.PRODUCT_UPLOADED, payload);
  }

  static ListingTransition confirm(ListingRecord current, Instant now) {
    requireState(current, ListingState.DRAFT);
    return new ListingTransition(
        current.state(),
        current.withState(ListingState.ACTIVE, null, null, now),
        AuditAction.PRODUCT_CONFIRMED,
        basePayload(current));
  }

  static ListingTransition cancel(ListingRecord current, Instant now) {
    requireState(current, ListingState.DRAFT);
    return new ListingTransition(
        current.state(),
        current.withState(ListingState.DISCARDED, null, null, now),
        AuditAction.PRODUCT_CANCELLED,
        basePayload(current));
  }

  static ListingTransition remove(ListingRecord current, Instant now, Duration undoWindow) {
    requireState(current, ListingState.ACTIVE);
    final Instant undoDeadline = now.plus(undoWindow);
    final Map<String, Object> payload = basePayload(current);
    payload.put("undo_deadline", undoDeadline.toString());
    return new ListingTransition(
        current.state(),
        current.withState(ListingState.REMOVED, now, undoDeadline, now),
        AuditAction.PRODUCT_REMOVED,
        payload);
  }

  /** The undo window is half-open: a restore at exactly the deadline is rejected. */
  static ListingTransition restore(ListingRecord current, Instant now) {
    requireState(current, ListingState.REMOVED);
    if (!now.isBefore(current.undoDeadline())) {
      throw new CatalogException(
          CatalogException.Reason.GONE,
          "undo window expired at " + current.undoDeadline() + " for listing " + current.listingId());
    }
    return new ListingTransition(
        current.state(),
        current.withState(ListingState.ACTIVE, null, null, now),
        AuditAction.PRODUCT_RESTORED,
        basePayload(current));
  }

  static ListingTransition purge(ListingRecord current, Instant now) {
    if (current.state().isTerminal()) {
      throw new CatalogException(
          CatalogException.Reason.CONFLICT,
          "listing " + current.listingId() + " is already " + current.state());
    }
    final Map<String, Object> payload = basePayload(current);
    payload.put("image_path", current.imagePath());
    return new ListingTransition(
        current.state(),
        current.withState(ListingState.PURGED, null, null, now),
        AuditAction.PRODUCT_PURGED,
        payload);
  }

  private static void requireState(ListingRecord listing, ListingState expected) {
    if (listing.state() != expected) {
      throw new CatalogException(
          CatalogException.Reason.CONFLICT,
          "listing " + listing.listingId() + " is " + listing.state() + ", expected " + expected);
    }
  }

  private static Map<String, Object> basePayload(ListingRecord listing) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", listing.name());
    payload.put("from_state", listing.state().name());
    return payload;
  }
}
