package com.example.catalog.webhook;

import com.example.catalog.config.WhatsAppProperties;
import com.example.catalog.service.InboundEvent;
import com.example.catalog.service.MessageRouter;
import com.example.catalog.service.RouteOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhook/whatsapp")
@RequiredArgsConstructor
public class WhatsAppWebhookController {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppWebhookController.class);

  private final WebhookPayloadParser payloadParser;
  private final MessageRouter messageRouter;
  private final WhatsAppProperties properties;

  /** Subscription handshake: echoes the challenge when the verify token matches. */
  @GetMapping
  public ResponseEntity<String> verify(
      @RequestParam(name = "hub.mode", required = false) String mode,
      @RequestParam(name = "hub.verify_token", required = false) String verifyToken,
      @RequestParam(name = "hub.challenge", required = false) String challenge) {
    final boolean tokenMatches =
        !properties.verifyToken().isBlank() && properties.verifyToken().equals(verifyToken);
    if ("subscribe".equals(mode) && tokenMatches && challenge != null) {
      return ResponseEntity.ok(challenge);
    }
    logger.warn("webhook verification failed mode={}", mode);
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body("verification failed");
  }

  @PostMapping
  public ResponseEntity<Map<String, String>> receive(@RequestBody JsonNode payload) {
    final Optional<InboundEvent> event = payloadParser.parse(payload);
    if (event.isEmpty()) {
      return ResponseEntity.ok(Map.of("status", "ignored"));
    }
    final RouteOutcome outcome = messageRouter.route(event.get());
    logger.info(
        "webhook event routed intent={} replies={}", outcome.intent(), outcome.deliveries().size());
    return ResponseEntity.ok(Map.of("status", "processed"));
  }
}
