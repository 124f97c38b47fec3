package com.example.catalog.service;

import com.example.catalog.model.ListingRecord;
import com.example.catalog.repository.ListingRepository;
import com.example.catalog.repository.SellerRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Listing reads and detail edits; state changes go through {@link ListingLifecycleService}. */
@Service
@RequiredArgsConstructor
public class ListingService {

  static final int MAX_NAME_LENGTH = 200;
  private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

  private final ListingRepository listingRepository;
  private final SellerRepository sellerRepository;
  private final Clock clock;

  public List<ListingRecord> listBySeller(UUID sellerId, boolean includeInactive) {
    if (sellerRepository.findById(sellerId).isEmpty()) {
      throw new CatalogException(
          CatalogException.Reason.NOT_FOUND, "seller not found: " + sellerId);
    }
    return listingRepository.findBySeller(sellerId, includeInactive);
  }

  public ListingRecord get(UUID listingId) {
    return listingRepository
        .findById(listingId)
        .orElseThrow(
            () ->
                new CatalogException(
                    CatalogException.Reason.NOT_FOUND, "listing not found: " + listingId));
  }

  /** Null arguments keep the current value. The price is stored rounded to two decimals. */
  public ListingRecord update(
      UUID listingId, String name, String description, BigDecimal price, String currency) {
    if (name != null && (name.isBlank() || name.length() > MAX_NAME_LENGTH)) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT,
          "name must be 1 to " + MAX_NAME_LENGTH + " characters");
    }
    final BigDecimal roundedPrice = price == null ? null : price.setScale(2, RoundingMode.HALF_UP);
    if (roundedPrice != null && !ListingRecord.priceInRange(roundedPrice)) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT,
          "price must be between 0 and " + ListingRecord.MAX_PRICE);
    }
    final String currencyCode = currency == null ? null : currency.strip().toUpperCase(Locale.ROOT);
    if (currencyCode != null && !CURRENCY_CODE.matcher(currencyCode).matches()) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT, "currency must be a 3 letter code");
    }
    return listingRepository
        .updateDetails(
            listingId,
            name == null ? null : name.strip(),
            description,
            roundedPrice,
            currencyCode,
            Instant.now(clock))
        .orElseThrow(
            () ->
                new CatalogException(
                    CatalogException.Reason.NOT_FOUND, "listing not found: " + listingId));
  }
}
