package com.example.catalog.service;

import java.util.List;
import java.util.UUID;

/** What the router did with one inbound event. {@code sellerId} is null for unknown senders. */
public record RouteOutcome(Intent intent, UUID sellerId, List<Delivery> deliveries) {

  public RouteOutcome {
    deliveries = List.copyOf(deliveries);
  }

  public record Delivery(OutboundMessage message, DeliveryResult result) {}

  public List<OutboundMessage> messages() {
    return deliveries.stream().map(Delivery::message).toList();
  }
}
