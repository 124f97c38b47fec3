package com.example.catalog.service;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/** Produces short public catalog handles from a lowercase alphanumeric alphabet. */
@Component
public class CatalogSlugGenerator {

  static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
  static final int SLUG_LENGTH = 8;

  private final SecureRandom random = new SecureRandom();

  public String generate() {
    final StringBuilder slug = new StringBuilder(SLUG_LENGTH);
    for (int i = 0; i < SLUG_LENGTH; i++) {
      slug.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return slug.toString();
  }
}
