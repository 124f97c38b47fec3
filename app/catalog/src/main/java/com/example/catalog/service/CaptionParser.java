/*
 * Where: catalog service layer
 * What: derives a listing name and price from a free-text photo caption
 * Why: sellers describe products in one line like "Red Shoes - $45.99"
 */
package com.example.catalog.service;

import com.example.catalog.model.ListingRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class CaptionParser {

  static final String DEFAULT_NAME = "Untitled Product";
  static final int MAX_UNPRICED_NAME_LENGTH = 50;
  static final int MAX_NAME_LENGTH = 200;

  private static final Pattern PRICE = Pattern.compile("[$£€]?(\\d+(?:\\.\\d{2})?)");
  private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s\\-–—:]+$");

  public ParsedCaption parse(String caption) {
    if (caption == null || caption.isBlank()) {
      return new ParsedCaption(DEFAULT_NAME, null, caption);
    }
    // Numbers too large for a price (phone numbers, product codes) are part of the name.
    final Matcher matcher = PRICE.matcher(caption);
    while (matcher.find()) {
      final BigDecimal price = new BigDecimal(matcher.group(1)).setScale(2, RoundingMode.HALF_UP);
      if (ListingRecord.priceInRange(price)) {
        final String head = caption.substring(0, matcher.start()).strip();
        final String name = TRAILING_SEPARATORS.matcher(head).replaceAll("");
        return new ParsedCaption(truncate(orDefault(name)), price, caption);
      }
    }
    final String head = caption.substring(0, Math.min(caption.length(), MAX_UNPRICED_NAME_LENGTH));
    return new ParsedCaption(orDefault(head.strip()), null, caption);
  }

  private String orDefault(String name) {
    return name.isEmpty() ? DEFAULT_NAME : name;
  }

  private String truncate(String name) {
    return name.length() <= MAX_NAME_LENGTH ? name : name.substring(0, MAX_NAME_LENGTH);
  }
}
