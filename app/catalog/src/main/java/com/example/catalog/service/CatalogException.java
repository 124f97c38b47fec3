package com.example.catalog.service;

/** Domain failure raised by the catalog services; {@link Reason} drives the caller's response. */
public class CatalogException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    CONFLICT,
    GONE,
    INVALID_INPUT,
    UPSTREAM_FAILURE
  }

  private final Reason reason;

  public CatalogException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CatalogException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
