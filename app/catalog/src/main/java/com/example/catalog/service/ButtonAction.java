package com.example.catalog.service;

import java.util.Optional;
import java.util.UUID;

/**
 * A parsed reply button id of the form {@code <verb>_<listingId>}. {@code listingId} is null
 * when the suffix is not a UUID.
 */
public record ButtonAction(Intent intent, UUID listingId) {

  static final String CONFIRM_PREFIX = "confirm_add_";
  static final String CANCEL_PREFIX = "cancel_add_";

  public static String confirmId(UUID listingId) {
    return CONFIRM_PREFIX + listingId;
  }

  public static String cancelId(UUID listingId) {
    return CANCEL_PREFIX + listingId;
  }

  /** Returns empty for unknown verbs. */
  public static Optional<ButtonAction> parse(String buttonId) {
    if (buttonId == null) {
      return Optional.empty();
    }
    if (buttonId.startsWith(CONFIRM_PREFIX)) {
      return Optional.of(of(Intent.CONFIRM, buttonId.substring(CONFIRM_PREFIX.length())));
    }
    if (buttonId.startsWith(CANCEL_PREFIX)) {
      return Optional.of(of(Intent.CANCEL, buttonId.substring(CANCEL_PREFIX.length())));
    }
    return Optional.empty();
  }

  private static ButtonAction of(Intent intent, String suffix) {
    try {
      return new ButtonAction(intent, UUID.fromString(suffix));
    } catch (IllegalArgumentException ex) {
      return new ButtonAction(intent, null);
    }
  }
}
