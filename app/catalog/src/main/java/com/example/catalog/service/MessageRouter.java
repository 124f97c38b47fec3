/*
 * Where: catalog service layer
 * What: handles one inbound channel event end to end
 * Why: classification, provisioning, lifecycle and replies must agree on one seller per event
 */
package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.SellerRecord;
import com.example.catalog.repository.SellerRepository;
import com.example.catalog.service.AuditTrailRecorder.AuditEntry;
import com.example.catalog.service.OutboundMessage.ReplyButton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageRouter {

  private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);
  private static final int AUDIT_TEXT_PREVIEW_LENGTH = 200;

  private final IntentClassifier intentClassifier;
  private final SellerProvisioningService provisioningService;
  private final SellerRepository sellerRepository;
  private final ListingLifecycleService lifecycleService;
  private final NotificationDispatcher notificationDispatcher;
  private final SellerMessages messages;
  private final AuditTrailRecorder auditTrailRecorder;
  private final CatalogMetrics metrics;

  public RouteOutcome route(InboundEvent event) {
    final Intent intent = intentClassifier.classify(event);
    if (event.from() == null || event.from().isBlank()) {
      logger.warn("inbound event without sender ignored intent={}", intent);
      return new RouteOutcome(Intent.IGNORED, null, List.of());
    }
    MDC.put("channel_id", event.from());
    if (event.messageId() != null) {
      MDC.put("message_id", event.messageId());
    }
    try {
      metrics.recordIntent(intent.name());
      final Optional<SellerRecord> knownSeller = sellerRepository.findByPhoneNumber(event.from());
      recordReceived(event, intent, knownSeller.map(SellerRecord::sellerId).orElse(null));
      final Replies replies = new Replies(knownSeller.orElse(null));
      handle(event, intent, replies);
      return dispatch(intent, replies);
    } finally {
      MDC.remove("channel_id");
      MDC.remove("message_id");
    }
  }

  private void handle(InboundEvent event, Intent intent, Replies replies) {
    try {
      switch (intent) {
        case REGISTRATION -> handleRegistration(event.from(), replies);
        case HELP -> replies.text(event.from(), messages.help());
        case CATALOG_LINK -> handleCatalogLink(event.from(), replies);
        case IMAGE_INTAKE -> handleImage((InboundEvent.Image) event, replies);
        case CONFIRM, CANCEL -> handleButton((InboundEvent.ButtonTap) event, replies);
        case FALLBACK -> replies.text(event.from(), messages.fallback());
        case IGNORED ->
            logger.debug("inbound event ignored type={}", event.getClass().getSimpleName());
        default -> throw new IllegalStateException("unhandled intent " + intent);
      }
    } catch (CatalogException ex) {
      logger.warn("inbound event failed intent={} reason={}", intent, ex.reason(), ex);
      recordError(intent, replies.sellerId(), ex);
      replies.text(event.from(), messages.somethingWentWrong());
    } catch (RuntimeException ex) {
      // infrastructure failure: surface it so the platform re-delivers the webhook
      recordError(intent, replies.sellerId(), ex);
      throw ex;
    }
  }

  private void handleRegistration(String from, Replies replies) {
    final ProvisionResult result = provisioningService.getOrCreate(from);
    replies.seller(result.seller());
    replies.text(
        from,
        result.created()
            ? messages.welcome(result.seller())
            : messages.welcomeBack(result.seller()));
  }

  private void handleCatalogLink(String from, Replies replies) {
    if (replies.seller() == null) {
      replies.text(from, messages.notRegistered());
      return;
    }
    replies.text(from, messages.catalogLink(replies.seller()));
  }

  private void handleImage(InboundEvent.Image image, Replies replies) {
    final ProvisionResult provisioned = provisioningService.getOrCreate(image.from());
    final SellerRecord seller = provisioned.seller();
    replies.seller(seller);
    if (provisioned.created()) {
      replies.text(image.from(), messages.welcome(seller));
    }
    final ListingRecord draft;
    try {
      draft = lifecycleService.intake(seller, image.mediaRef(), image.caption());
    } catch (CatalogException ex) {
      if (ex.reason() == CatalogException.Reason.INVALID_INPUT) {
        logger.info("image rejected sellerId={} reason={}", seller.sellerId(), ex.getMessage());
        replies.text(image.from(), messages.imageRejected(ex.getMessage()));
        return;
      }
      if (ex.reason() == CatalogException.Reason.UPSTREAM_FAILURE) {
        logger.warn("image download failed sellerId={}", seller.sellerId(), ex);
        recordError(Intent.IMAGE_INTAKE, seller.sellerId(), ex);
        replies.text(image.from(), messages.imageDownloadFailed());
        return;
      }
      throw ex;
    }
    replies.chain(
        OutboundMessage.image(image.from(), draft.imageUrl(), messages.uploadPromptCaption(draft)),
        OutboundMessage.buttons(
            image.from(),
            messages.uploadPromptQuestion(draft),
            List.of(
                new ReplyButton(
                    ButtonAction.confirmId(draft.listingId()), SellerMessages.ADD_BUTTON_TITLE),
                new ReplyButton(
                    ButtonAction.cancelId(draft.listingId()), SellerMessages.CANCEL_BUTTON_TITLE))));
  }

  private void handleButton(InboundEvent.ButtonTap tap, Replies replies) {
    final Optional<ButtonAction> action = ButtonAction.parse(tap.buttonId());
    final UUID listingId = action.map(ButtonAction::listingId).orElse(null);
    final SellerRecord seller = replies.seller();
    if (listingId == null || seller == null) {
      logger.info("button refers to no listing of the sender buttonId={}", tap.buttonId());
      replies.text(tap.from(), messages.listingNotFound());
      return;
    }
    try {
      if (action.get().intent() == Intent.CONFIRM) {
        final ListingRecord confirmed = lifecycleService.confirm(listingId, seller.sellerId());
        replies.text(tap.from(), messages.added(confirmed, seller));
      } else {
        final ListingRecord discarded = lifecycleService.cancel(listingId, seller.sellerId());
        replies.text(tap.from(), messages.notAdded(discarded));
      }
    } catch (CatalogException ex) {
      if (ex.reason() == CatalogException.Reason.NOT_FOUND) {
        replies.text(tap.from(), messages.listingNotFound());
        return;
      }
      if (ex.reason() == CatalogException.Reason.CONFLICT) {
        replies.text(tap.from(), messages.alreadyHandled());
        return;
      }
      throw ex;
    }
  }

  private RouteOutcome dispatch(Intent intent, Replies replies) {
    final List<RouteOutcome.Delivery> deliveries = new ArrayList<>();
    for (List<OutboundMessage> chain : replies.chains()) {
      final List<DeliveryResult> results =
          notificationDispatcher.dispatchInOrder(chain, replies.sellerId());
      for (int i = 0; i < results.size(); i++) {
        deliveries.add(new RouteOutcome.Delivery(chain.get(i), results.get(i)));
      }
    }
    return new RouteOutcome(intent, replies.sellerId(), deliveries);
  }

  private void recordReceived(InboundEvent event, Intent intent, UUID sellerId) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("from", event.from());
    payload.put("intent", intent.name());
    if (event instanceof InboundEvent.Text text) {
      payload.put("type", "text");
      payload.put("body", preview(text.body()));
    } else if (event instanceof InboundEvent.Image image) {
      payload.put("type", "image");
      payload.put("media_id", image.mediaRef());
      payload.put("caption", preview(image.caption()));
    } else if (event instanceof InboundEvent.ButtonTap tap) {
      payload.put("type", "button");
      payload.put("button_id", tap.buttonId());
    }
    auditTrailRecorder.record(
        AuditEntry.of(AuditAction.MESSAGE_RECEIVED, payload)
            .seller(sellerId)
            .externalMessageId(event.messageId()));
  }

  private void recordError(Intent intent, UUID sellerId, RuntimeException ex) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("intent", intent.name());
    payload.put("error", ex.getClass().getSimpleName());
    payload.put("message", String.valueOf(ex.getMessage()));
    if (ex instanceof CatalogException catalogException) {
      payload.put("reason", catalogException.reason().name());
    }
    auditTrailRecorder.record(AuditEntry.of(AuditAction.ERROR, payload).seller(sellerId));
  }

  private static String preview(String text) {
    if (text == null || text.length() <= AUDIT_TEXT_PREVIEW_LENGTH) {
      return text;
    }
    return text.substring(0, AUDIT_TEXT_PREVIEW_LENGTH);
  }

  /** Replies collected while handling one event; each chain is sent in order. */
  private static final class Replies {

    private final List<List<OutboundMessage>> chains = new ArrayList<>();
    private SellerRecord seller;

    Replies(SellerRecord seller) {
      this.seller = seller;
    }

    void text(String to, String body) {
      chains.add(List.of(OutboundMessage.text(to, body)));
    }

    void chain(OutboundMessage... messages) {
      chains.add(List.of(messages));
    }

    void seller(SellerRecord resolved) {
      this.seller = resolved;
    }

    SellerRecord seller() {
      return seller;
    }

    UUID sellerId() {
      return seller == null ? null : seller.sellerId();
    }

    List<List<OutboundMessage>> chains() {
      return chains;
    }
  }
}
