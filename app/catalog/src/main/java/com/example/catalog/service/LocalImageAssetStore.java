/*
 * Where: catalog service layer
 * What: stores listing images on the local filesystem
 * Why: images are served back under the public upload prefix by WebMvcConfig
 */
package com.example.catalog.service;

import com.example.catalog.config.AssetStorageProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalImageAssetStore implements ImageAssetStore {

  private static final Logger logger = LoggerFactory.getLogger(LocalImageAssetStore.class);
  private static final Map<String, String> EXTENSIONS =
      Map.of(
          "image/jpeg", ".jpg",
          "image/jpg", ".jpg",
          "image/png", ".png",
          "image/webp", ".webp");

  private final AssetStorageProperties properties;
  private final Path uploadDir;

  public LocalImageAssetStore(AssetStorageProperties properties) {
    this.properties = properties;
    this.uploadDir = Path.of(properties.uploadDir()).toAbsolutePath().normalize();
  }

  @Override
  public StoredAsset store(DownloadedImage image) {
    final String fileName = UUID.randomUUID() + extensionFor(image.contentType());
    final Path target = uploadDir.resolve(fileName);
    try {
      Files.createDirectories(uploadDir);
      Files.write(target, image.content());
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to store image " + fileName, ex);
    }
    logger.debug("image stored path={} size={}", target, image.size());
    return new StoredAsset(properties.publicUrl(fileName), target.toString());
  }

  @Override
  public boolean delete(String storagePath) {
    if (storagePath == null || storagePath.isBlank()) {
      return false;
    }
    final Path target = Path.of(storagePath).toAbsolutePath().normalize();
    if (!target.startsWith(uploadDir)) {
      logger.warn("refusing to delete asset outside upload dir path={}", storagePath);
      return false;
    }
    try {
      return Files.deleteIfExists(target);
    } catch (IOException ex) {
      logger.warn("asset deletion failed path={}", storagePath, ex);
      return false;
    }
  }

  private String extensionFor(String contentType) {
    if (contentType == null) {
      return ".jpg";
    }
    return EXTENSIONS.getOrDefault(ImageUploadValidator.baseType(contentType), ".jpg");
  }
}
