package com.example.catalog.service;

public class WhatsAppIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE,
    PAYLOAD_TOO_LARGE
  }

  private final Reason reason;

  public WhatsAppIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public WhatsAppIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
