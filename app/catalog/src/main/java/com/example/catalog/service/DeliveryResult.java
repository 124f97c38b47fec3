package com.example.catalog.service;

/** Outcome of one send attempt; {@code externalMessageId} is the platform's id on success. */
public record DeliveryResult(boolean delivered, String externalMessageId, String error) {

  public static DeliveryResult delivered(String externalMessageId) {
    return new DeliveryResult(true, externalMessageId, null);
  }

  public static DeliveryResult failed(String error) {
    return new DeliveryResult(false, null, error);
  }
}
