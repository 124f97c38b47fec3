/*
 * Where: catalog application configuration binding
 * What: listing lifecycle and intake limits
 * Why: the undo window and upload limits differ between environments and tests
 */
package com.example.catalog.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "catalog.listing")
public record ListingProperties(
    Duration undoWindow,
    DataSize maxUploadSize,
    List<String> allowedContentTypes,
    String defaultCurrency,
    String catalogBaseUrl) {

  public ListingProperties {
    undoWindow = undoWindow == null ? Duration.ofSeconds(30) : undoWindow;
    maxUploadSize = maxUploadSize == null ? DataSize.ofMegabytes(10) : maxUploadSize;
    allowedContentTypes =
        allowedContentTypes == null || allowedContentTypes.isEmpty()
            ? List.of("image/jpeg", "image/jpg", "image/png", "image/webp")
            : List.copyOf(allowedContentTypes);
    defaultCurrency =
        defaultCurrency == null || defaultCurrency.isBlank() ? "USD" : defaultCurrency;
    catalogBaseUrl =
        catalogBaseUrl == null || catalogBaseUrl.isBlank()
            ? "https://catalog.example.com/catalog"
            : catalogBaseUrl;
  }

  public String catalogUrl(String catalogSlug) {
    return catalogBaseUrl + "/" + catalogSlug;
  }
}
