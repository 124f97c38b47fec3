package com.example.catalog.service;

import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/** Phone number normalisation and click-to-chat links. */
public final class PhoneNumbers {

  static final String CHAT_LINK_BASE = "https://wa.me/";
  private static final int NATIONAL_NUMBER_LENGTH = 10;

  private PhoneNumbers() {}

  /** Keeps digits only and prefixes {@code defaultCountryCode} to bare ten digit numbers. */
  public static String normalize(String phoneNumber, String defaultCountryCode) {
    if (phoneNumber == null) {
      return "";
    }
    final String digits = phoneNumber.replaceAll("\\D", "");
    if (digits.length() == NATIONAL_NUMBER_LENGTH) {
      return defaultCountryCode + digits;
    }
    return digits;
  }

  /** {@code https://wa.me/<digits>?text=<percent-encoded text>}; no query for empty text. */
  public static String chatLink(String phoneNumber, String text, String defaultCountryCode) {
    final String link = CHAT_LINK_BASE + normalize(phoneNumber, defaultCountryCode);
    if (text == null || text.isEmpty()) {
      return link;
    }
    return link + "?text=" + UriUtils.encode(text, StandardCharsets.UTF_8);
  }
}
