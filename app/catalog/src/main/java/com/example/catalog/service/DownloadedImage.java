package com.example.catalog.service;

/** Raw image bytes fetched from the messaging platform together with their declared type. */
public record DownloadedImage(byte[] content, String contentType) {

  public DownloadedImage {
    content = content == null ? new byte[0] : content.clone();
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  public int size() {
    return content.length;
  }
}
