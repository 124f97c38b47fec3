package com.example.catalog.service;

import java.util.Optional;

/** Turns an inbound media reference into downloadable bytes. */
public interface MediaResolver {

  /** Returns the download URL for {@code mediaId}, or empty when the platform has none. */
  Optional<String> resolveMediaUrl(String mediaId);

  DownloadedImage download(String mediaUrl);
}
