/*
 * Where: catalog webhook boundary
 * What: turns a WhatsApp Cloud API webhook envelope into one inbound event
 * Why: the router only knows the three event variants, never the platform's payload shape
 */
package com.example.catalog.webhook;

import com.example.catalog.service.InboundEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WebhookPayloadParser {

  private static final Logger logger = LoggerFactory.getLogger(WebhookPayloadParser.class);

  /** Returns empty for status updates, unsupported message types and malformed envelopes. */
  public Optional<InboundEvent> parse(JsonNode payload) {
    if (payload == null) {
      return Optional.empty();
    }
    final JsonNode message =
        payload
            .path("entry")
            .path(0)
            .path("changes")
            .path(0)
            .path("value")
            .path("messages")
            .path(0);
    if (message.isMissingNode() || !message.isObject()) {
      return Optional.empty();
    }
    final String from = text(message, "from");
    if (from == null) {
      logger.debug("webhook message without sender ignored");
      return Optional.empty();
    }
    final String messageId = text(message, "id");
    final String type = message.path("type").asText("");
    switch (type) {
      case "text":
        return Optional.of(
            new InboundEvent.Text(from, message.path("text").path("body").asText(""), messageId));
      case "image":
        final JsonNode image = message.path("image");
        return Optional.of(
            new InboundEvent.Image(from, text(image, "id"), text(image, "caption"), messageId));
      case "interactive":
        final String buttonId = text(message.path("interactive").path("button_reply"), "id");
        if (buttonId == null) {
          return unsupported(type, messageId);
        }
        return Optional.of(new InboundEvent.ButtonTap(from, buttonId, messageId));
      default:
        return unsupported(type, messageId);
    }
  }

  private Optional<InboundEvent> unsupported(String type, String messageId) {
    logger.debug("webhook message type not handled type={} messageId={}", type, messageId);
    return Optional.empty();
  }

  private static String text(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText();
  }
}
