package com.example.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local image storage. {@code publicBaseUrl} must be reachable by the messaging platform since
 * upload prompts send the stored image back to the seller.
 */
@ConfigurationProperties(prefix = "catalog.assets")
public record AssetStorageProperties(
    String uploadDir, String publicUrlPrefix, String publicBaseUrl) {

  public AssetStorageProperties {
    uploadDir = uploadDir == null || uploadDir.isBlank() ? "uploads" : uploadDir;
    publicUrlPrefix =
        publicUrlPrefix == null || publicUrlPrefix.isBlank() ? "/uploads" : publicUrlPrefix;
    publicBaseUrl =
        publicBaseUrl == null || publicBaseUrl.isBlank() ? "http://localhost:8080" : publicBaseUrl;
  }

  public String publicUrl(String fileName) {
    return publicBaseUrl + publicUrlPrefix + "/" + fileName;
  }
}
