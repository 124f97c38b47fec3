package com.example.catalog.service.dto;

import java.util.List;

/** Graph API reply to a message send; only the message ids are used. */
public record WhatsAppSendResponse(List<MessageRef> messages) {

  public WhatsAppSendResponse {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public record MessageRef(String id) {}
}
