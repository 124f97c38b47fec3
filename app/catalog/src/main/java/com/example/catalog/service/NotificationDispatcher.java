/*
 * Where: catalog service layer
 * What: sends outbound messages and audits every attempt
 * Why: a delivery failure is reported and audited but never rolls back the change that caused it
 */
package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.service.AuditTrailRecorder.AuditEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);
  private static final int AUDIT_BODY_PREVIEW_LENGTH = 200;

  private final SellerNotifier sellerNotifier;
  private final AuditTrailRecorder auditTrailRecorder;
  private final CatalogMetrics metrics;

  public DeliveryResult dispatch(OutboundMessage message, UUID sellerId) {
    DeliveryResult result;
    try {
      result = deliver(message);
    } catch (RuntimeException ex) {
      logger.error("notifier failed type={} to={}", message.type(), message.to(), ex);
      result = DeliveryResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
    audit(message, sellerId, result);
    return result;
  }

  /**
   * Sends {@code messages} one after another and stops at the first failure, so a follow-up is
   * never sent without the message it refers to.
   */
  public List<DeliveryResult> dispatchInOrder(List<OutboundMessage> messages, UUID sellerId) {
    final List<DeliveryResult> results = new ArrayList<>();
    for (OutboundMessage message : messages) {
      final DeliveryResult result = dispatch(message, sellerId);
      results.add(result);
      if (!result.delivered()) {
        break;
      }
    }
    return results;
  }

  private DeliveryResult deliver(OutboundMessage message) {
    return switch (message.type()) {
      case TEXT -> sellerNotifier.sendText(message.to(), message.body());
      case IMAGE -> sellerNotifier.sendImage(message.to(), message.mediaUrl(), message.body());
      case BUTTONS -> sellerNotifier.sendButtons(message.to(), message.body(), message.buttons());
    };
  }

  private void audit(OutboundMessage message, UUID sellerId, DeliveryResult result) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("message_type", message.type().name());
    payload.put("to", message.to());
    if (message.body() != null) {
      payload.put("body_preview", preview(message.body()));
    }
    if (result.delivered()) {
      metrics.recordDelivery("delivered");
      auditTrailRecorder.record(
          AuditEntry.of(AuditAction.MESSAGE_SENT, payload)
              .seller(sellerId)
              .externalMessageId(result.externalMessageId()));
      return;
    }
    metrics.recordDelivery("failed");
    payload.put("error", result.error());
    logger.warn(
        "message delivery failed type={} to={} error={}",
        message.type(),
        message.to(),
        result.error());
    auditTrailRecorder.record(AuditEntry.of(AuditAction.ERROR, payload).seller(sellerId));
  }

  private static String preview(String body) {
    return body.length() <= AUDIT_BODY_PREVIEW_LENGTH
        ? body
        : body.substring(0, AUDIT_BODY_PREVIEW_LENGTH);
  }
}
