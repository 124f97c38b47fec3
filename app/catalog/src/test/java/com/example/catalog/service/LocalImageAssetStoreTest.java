package com.example.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.catalog.config.AssetStorageProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalImageAssetStoreTest {

  @TempDir Path tempDir;

  private Path uploadDir;
  private LocalImageAssetStore store;

  @BeforeEach
  void setUp() {
    uploadDir = tempDir.resolve("uploads");
    store =
        new LocalImageAssetStore(
            new AssetStorageProperties(uploadDir.toString(), "/uploads", "https://catalog.test"));
  }

  @Test
  void storesBytesUnderUploadDirWithTypeExtension() throws IOException {
    final StoredAsset asset = store.store(new DownloadedImage(new byte[] {1, 2, 3}, "image/png"));

    final Path stored = Path.of(asset.storagePath());
    assertThat(stored.getParent()).isEqualTo(uploadDir.toAbsolutePath().normalize());
    assertThat(stored.getFileName().toString()).endsWith(".png");
    assertThat(Files.readAllBytes(stored)).containsExactly(1, 2, 3);
    assertThat(asset.publicUrl())
        .isEqualTo("https://catalog.test/uploads/" + stored.getFileName());
  }

  @Test
  void unknownTypeDefaultsToJpg() {
    final StoredAsset asset = store.store(new DownloadedImage(new byte[] {1}, null));

    assertThat(asset.storagePath()).endsWith(".jpg");
  }

  @Test
  void deleteRemovesStoredAssetOnce() {
    final StoredAsset asset = store.store(new DownloadedImage(new byte[] {1}, "image/jpeg"));

    assertThat(store.delete(asset.storagePath())).isTrue();
    assertThat(Files.exists(Path.of(asset.storagePath()))).isFalse();
    assertThat(store.delete(asset.storagePath())).isFalse();
  }

  @Test
  void deleteRefusesPathsOutsideUploadDir() throws IOException {
    final Path outside = Files.writeString(tempDir.resolve("keep.txt"), "keep");

    assertThat(store.delete(outside.toString())).isFalse();
    assertThat(store.delete(uploadDir.resolve("../keep.txt").toString())).isFalse();
    assertThat(Files.exists(outside)).isTrue();
    assertThat(store.delete(null)).isFalse();
  }
}
