package com.example.catalog.service;

/**
 * One inbound message from the messaging channel. {@code messageId} is the platform's id and may
 * be null for events that did not come through the webhook.
 */
public interface InboundEvent {

  String from();

  String messageId();

  record Text(String from, String body, String messageId) implements InboundEvent {}

  record Image(String from, String mediaRef, String caption, String messageId)
      implements InboundEvent {}

  record ButtonTap(String from, String buttonId, String messageId) implements InboundEvent {}
}
