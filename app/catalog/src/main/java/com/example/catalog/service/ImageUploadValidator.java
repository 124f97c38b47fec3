package com.example.catalog.service;

import com.example.catalog.config.ListingProperties;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Rejects downloaded images whose type or size falls outside the configured limits. */
@Component
@RequiredArgsConstructor
public class ImageUploadValidator {

  private final ListingProperties properties;

  public void validate(DownloadedImage image) {
    final String contentType = baseType(image.contentType());
    if (contentType.isEmpty() || !properties.allowedContentTypes().contains(contentType)) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT,
          "unsupported image type: " + (contentType.isEmpty() ? "unknown" : contentType));
    }
    if (image.size() == 0) {
      throw new CatalogException(CatalogException.Reason.INVALID_INPUT, "image is empty");
    }
    if (image.size() > properties.maxUploadSize().toBytes()) {
      throw new CatalogException(
          CatalogException.Reason.INVALID_INPUT,
          "image exceeds " + properties.maxUploadSize().toMegabytes() + "MB limit");
    }
  }

  /** {@code "image/JPEG; charset=binary"} becomes {@code "image/jpeg"}. */
  static String baseType(String contentType) {
    if (contentType == null) {
      return "";
    }
    final int separator = contentType.indexOf(';');
    final String base = separator < 0 ? contentType : contentType.substring(0, separator);
    return base.trim().toLowerCase(Locale.ROOT);
  }
}
