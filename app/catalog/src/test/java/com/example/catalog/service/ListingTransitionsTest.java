/*
 * Where: catalog listing lifecycle tests
 * What: the allowed edges, their audit kinds and the half-open undo window
 * Why: every other lifecycle path is built on these pure transition functions
 */
package com.example.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ListingTransitionsTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final Duration UNDO_WINDOW = Duration.ofSeconds(30);

  @Test
  void uploadAuditsDraftWithPrice() {
    final ListingTransition transition = ListingTransitions.upload(listing(ListingState.DRAFT));

    assertThat(transition.from()).isNull();
    assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_UPLOADED);
    assertThat(transition.auditPayload())
        .containsEntry("name", "Red Shoes")
        .containsEntry("price", "45.99")
        .containsEntry("image_url", "https://catalog.test/uploads/a.jpg");
  }

  @Test
  void confirmActivatesDraft() {
    final ListingTransition transition =
        ListingTransitions.confirm(listing(ListingState.DRAFT), NOW);

    assertThat(transition.from()).isEqualTo(ListingState.DRAFT);
    assertThat(transition.listing().state()).isEqualTo(ListingState.ACTIVE);
    assertThat(transition.listing().updatedAt()).isEqualTo(NOW);
    assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_CONFIRMED);
  }

  @Test
  void cancelDiscardsDraft() {
    final ListingTransition transition = ListingTransitions.cancel(listing(ListingState.DRAFT), NOW);

    assertThat(transition.listing().state()).isEqualTo(ListingState.DISCARDED);
    assertThat(transition.listing().state().isTerminal()).isTrue();
    assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_CANCELLED);
  }

  @Test
  void confirmAndCancelRejectNonDraft() {
    for (ListingState state : new ListingState[] {ListingState.ACTIVE, ListingState.REMOVED}) {
      assertThatThrownBy(() -> ListingTransitions.confirm(listing(state), NOW))
          .isInstanceOf(CatalogException.class)
          .extracting(ex -> ((CatalogException) ex).reason())
          .isEqualTo(CatalogException.Reason.CONFLICT);
      assertThatThrownBy(() -> ListingTransitions.cancel(listing(state), NOW))
          .isInstanceOf(CatalogException.class)
          .extracting(ex -> ((CatalogException) ex).reason())
          .isEqualTo(CatalogException.Reason.CONFLICT);
    }
  }

  @Test
  void removeStampsRemovalAndDeadline() {
    final ListingTransition transition =
        ListingTransitions.remove(listing(ListingState.ACTIVE), NOW, UNDO_WINDOW);

    assertThat(transition.listing().state()).isEqualTo(ListingState.REMOVED);
    assertThat(transition.listing().removedAt()).isEqualTo(NOW);
    assertThat(transition.listing().undoDeadline()).isEqualTo(NOW.plus(UNDO_WINDOW));
    assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_REMOVED);
    assertThat(transition.auditPayload())
        .containsEntry("undo_deadline", NOW.plus(UNDO_WINDOW).toString());
  }

  @Test
  void removeRejectsDraft() {
    assertThatThrownBy(
            () -> ListingTransitions.remove(listing(ListingState.DRAFT), NOW, UNDO_WINDOW))
        .isInstanceOf(CatalogException.class);
  }

  @Test
  void restoreInsideWindowClearsRemovalFields() {
    final ListingRecord removed =
        ListingTransitions.remove(listing(ListingState.ACTIVE), NOW, UNDO_WINDOW).listing();

    final ListingTransition transition =
        ListingTransitions.restore(removed, NOW.plus(UNDO_WINDOW).minusMillis(1));

    assertThat(transition.listing().state()).isEqualTo(ListingState.ACTIVE);
    assertThat(transition.listing().removedAt()).isNull();
    assertThat(transition.listing().undoDeadline()).isNull();
    assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_RESTORED);
  }

  @Test
  void restoreAtExactDeadlineIsGone() {
    final ListingRecord removed =
        ListingTransitions.remove(listing(ListingState.ACTIVE), NOW, UNDO_WINDOW).listing();

    assertThatThrownBy(() -> ListingTransitions.restore(removed, NOW.plus(UNDO_WINDOW)))
        .isInstanceOf(CatalogException.class)
        .extracting(ex -> ((CatalogException) ex).reason())
        .isEqualTo(CatalogException.Reason.GONE);
  }

  @Test
  void purgeAcceptsEveryLiveState() {
    for (ListingState state :
        new ListingState[] {ListingState.DRAFT, ListingState.ACTIVE, ListingState.REMOVED}) {
      final ListingTransition transition = ListingTransitions.purge(listing(state), NOW);

      assertThat(transition.from()).isEqualTo(state);
      assertThat(transition.listing().state()).isEqualTo(ListingState.PURGED);
      assertThat(transition.auditAction()).isEqualTo(AuditAction.PRODUCT_PURGED);
      assertThat(transition.auditPayload()).containsEntry("image_path", "/tmp/uploads/a.jpg");
    }
  }

  private static ListingRecord listing(ListingState state) {
    final boolean removed = state == ListingState.REMOVED;
    return new ListingRecord(
        UUID.randomUUID(),
        UUID.randomUUID(),
        "Red Shoes",
        "Red Shoes $45.99",
        new BigDecimal("45.99"),
        "USD",
        "https://catalog.test/uploads/a.jpg",
        "/tmp/uploads/a.jpg",
        state,
        removed ? NOW.minusSeconds(10) : null,
        removed ? NOW.plusSeconds(20) : null,
        NOW.minusSeconds(60),
        NOW.minusSeconds(60));
  }
}
