package com.example.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.ListingRepository;
import com.example.catalog.repository.SellerRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ListingServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final UUID SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
  private static final UUID LISTING_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

  @Mock private ListingRepository listingRepository;
  @Mock private SellerRepository sellerRepository;

  private ListingService service;

  @BeforeEach
  void setUp() {
    service =
        new ListingService(
            listingRepository, sellerRepository, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void listBySellerRequiresKnownSeller() {
    when(sellerRepository.findById(SELLER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.listBySeller(SELLER_ID, false))
        .isInstanceOfSatisfying(
            CatalogException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CatalogException.Reason.NOT_FOUND));
    verifyNoInteractions(listingRepository);
  }

  @Test
  void listBySellerDelegatesFilter() {
    when(sellerRepository.findById(SELLER_ID))
        .thenReturn(
            Optional.of(
                new SellerRecord(
                    SELLER_ID, "15551234567", null, "slug", true, FIXED_NOW, FIXED_NOW)));
    when(listingRepository.findBySeller(SELLER_ID, true)).thenReturn(List.of(listing()));

    assertThat(service.listBySeller(SELLER_ID, true)).hasSize(1);
  }

  @Test
  void updateRoundsPriceAndUppercasesCurrency() {
    when(listingRepository.updateDetails(
            LISTING_ID, "Scarf", null, new BigDecimal("12.35"), "EUR", FIXED_NOW))
        .thenReturn(Optional.of(listing()));

    service.update(LISTING_ID, " Scarf ", null, new BigDecimal("12.345"), "eur");

    verify(listingRepository)
        .updateDetails(LISTING_ID, "Scarf", null, new BigDecimal("12.35"), "EUR", FIXED_NOW);
  }

  @Test
  void updateRejectsInvalidInput() {
    assertInvalid(() -> service.update(LISTING_ID, " ", null, null, null));
    assertInvalid(() -> service.update(LISTING_ID, null, null, new BigDecimal("-1"), null));
    assertInvalid(() -> service.update(LISTING_ID, null, null, null, "EURO"));
    verifyNoInteractions(listingRepository);
  }

  @Test
  void updateRejectsPriceBeyondStorableRange() {
    assertInvalid(
        () -> service.update(LISTING_ID, null, null, new BigDecimal("1000000000000"), null));
    assertInvalid(
        () -> service.update(LISTING_ID, null, null, new BigDecimal("9999999999.995"), null));
    verifyNoInteractions(listingRepository);
  }

  @Test
  void updateOfUnknownListingIsNotFound() {
    when(listingRepository.updateDetails(LISTING_ID, null, "d", null, null, FIXED_NOW))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.update(LISTING_ID, null, "d", null, null))
        .isInstanceOfSatisfying(
            CatalogException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CatalogException.Reason.NOT_FOUND));
  }

  private static void assertInvalid(Runnable call) {
    assertThatThrownBy(call::run)
        .isInstanceOfSatisfying(
            CatalogException.class,
            ex -> assertThat(ex.reason()).isEqualTo(CatalogException.Reason.INVALID_INPUT));
  }

  private static ListingRecord listing() {
    return new ListingRecord(
        LISTING_ID,
        SELLER_ID,
        "Scarf",
        null,
        new BigDecimal("12.35"),
        "EUR",
        "https://catalog.test/uploads/a.jpg",
        "a.jpg",
        ListingState.ACTIVE,
        null,
        null,
        FIXED_NOW,
        FIXED_NOW);
  }
}
