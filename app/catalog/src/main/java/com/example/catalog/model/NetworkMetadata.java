package com.example.catalog.model;

/** Caller details attached to audit records written on behalf of an HTTP request. */
public record NetworkMetadata(String ipAddress, String userAgent) {

  public static final NetworkMetadata NONE = new NetworkMetadata(null, null);
}
