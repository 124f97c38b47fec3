package com.example.catalog.service;

/** Storage for listing images. */
public interface ImageAssetStore {

  StoredAsset store(DownloadedImage image);

  /**
   * Deletes the asset at {@code storagePath}.
   *
   * @return {@code false} when nothing was deleted or deletion failed
   */
  boolean delete(String storagePath);
}
