package com.example.catalog.service;

import java.util.List;

/**
 * A message to one recipient. {@code mediaUrl} is set for {@link Type#IMAGE}, {@code buttons}
 * for {@link Type#BUTTONS}.
 */
public record OutboundMessage(
    Type type, String to, String body, String mediaUrl, List<ReplyButton> buttons) {

  public enum Type {
    TEXT,
    IMAGE,
    BUTTONS
  }

  public record ReplyButton(String id, String title) {}

  public OutboundMessage {
    buttons = buttons == null ? List.of() : List.copyOf(buttons);
  }

  public static OutboundMessage text(String to, String body) {
    return new OutboundMessage(Type.TEXT, to, body, null, List.of());
  }

  public static OutboundMessage image(String to, String mediaUrl, String caption) {
    return new OutboundMessage(Type.IMAGE, to, caption, mediaUrl, List.of());
  }

  public static OutboundMessage buttons(String to, String body, List<ReplyButton> buttons) {
    return new OutboundMessage(Type.BUTTONS, to, body, null, buttons);
  }
}
