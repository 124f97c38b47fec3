package com.example.catalog.service;

import com.example.catalog.config.ListingProperties;
import com.example.catalog.config.WhatsAppProperties;
import com.example.catalog.service.OutboundMessage.ReplyButton;
import com.example.catalog.service.dto.WhatsAppMediaResponse;
import com.example.catalog.service.dto.WhatsAppSendResponse;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** WhatsApp Cloud API adapter for outbound messages and inbound media. */
@Service
@RequiredArgsConstructor
public class WhatsAppCloudClient implements SellerNotifier, MediaResolver {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppCloudClient.class);
  static final int MAX_BUTTONS = 3;
  static final int MAX_BUTTON_TITLE_LENGTH = 20;
  static final int MAX_INTERACTIVE_BODY_LENGTH = 1024;

  private final RestClient whatsAppRestClient;
  private final WhatsAppProperties properties;
  private final ListingProperties listingProperties;

  @Override
  public DeliveryResult sendText(String to, String body) {
    final Map<String, Object> payload = basePayload(to, "text");
    payload.put("text", Map.of("preview_url", false, "body", body));
    return send(payload);
  }

  @Override
  public DeliveryResult sendImage(String to, String imageUrl, String caption) {
    final Map<String, Object> image = new LinkedHashMap<>();
    image.put("link", imageUrl);
    if (caption != null && !caption.isEmpty()) {
      image.put("caption", caption);
    }
    final Map<String, Object> payload = basePayload(to, "image");
    payload.put("image", image);
    return send(payload);
  }

  @Override
  public DeliveryResult sendButtons(String to, String body, List<ReplyButton> buttons) {
    final List<Map<String, Object>> replyButtons =
        buttons.stream()
            .limit(MAX_BUTTONS)
            .map(
                button ->
                    Map.<String, Object>of(
                        "type",
                        "reply",
                        "reply",
                        Map.of(
                            "id", button.id(),
                            "title", truncate(button.title(), MAX_BUTTON_TITLE_LENGTH))))
            .toList();
    final Map<String, Object> payload = basePayload(to, "interactive");
    payload.put(
        "interactive",
        Map.of(
            "type", "button",
            "body", Map.of("text", truncate(body, MAX_INTERACTIVE_BODY_LENGTH)),
            "action", Map.of("buttons", replyButtons)));
    return send(payload);
  }

  @Override
  public Optional<String> resolveMediaUrl(String mediaId) {
    requireConfigured();
    final WhatsAppMediaResponse response =
        call(
            () ->
                whatsAppRestClient
                    .get()
                    .uri(properties.mediaPath(), mediaId)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .retrieve()
                    .body(WhatsAppMediaResponse.class),
            "media lookup");
    if (response == null || response.url() == null || response.url().isBlank()) {
      logger.warn("media lookup returned no url mediaId={}", mediaId);
      return Optional.empty();
    }
    return Optional.of(response.url());
  }

  /**
   * Downloads at most {@code catalog.listing.max-upload-size} bytes. A larger declared or actual
   * body is rejected as {@code PAYLOAD_TOO_LARGE} before it is buffered in full.
   */
  @Override
  public DownloadedImage download(String mediaUrl) {
    requireConfigured();
    final long maxBytes = listingProperties.maxUploadSize().toBytes();
    return call(
        () ->
            whatsAppRestClient
                .get()
                .uri(URI.create(mediaUrl))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .exchange(
                    (request, response) -> {
                      if (response.getStatusCode().isError()) {
                        throw statusFailure(
                            response.getStatusCode().value(), "media download", null);
                      }
                      final long declaredLength = response.getHeaders().getContentLength();
                      if (declaredLength > maxBytes) {
                        throw tooLarge(declaredLength, maxBytes);
                      }
                      final byte[] body;
                      try (InputStream stream = response.getBody()) {
                        body = stream.readNBytes(Math.toIntExact(maxBytes + 1));
                      }
                      if (body.length > maxBytes) {
                        throw tooLarge(body.length, maxBytes);
                      }
                      final MediaType contentType = response.getHeaders().getContentType();
                      return new DownloadedImage(
                          body, contentType == null ? null : contentType.toString());
                    }),
        "media download");
  }

  private static WhatsAppIntegrationException tooLarge(long length, long maxBytes) {
    return new WhatsAppIntegrationException(
        WhatsAppIntegrationException.Reason.PAYLOAD_TOO_LARGE,
        "media download of " + length + " bytes exceeds " + maxBytes + " byte limit");
  }

  private DeliveryResult send(Map<String, Object> payload) {
    if (!isConfigured()) {
      logger.warn("whatsapp credentials not configured, message not sent to={}", payload.get("to"));
      return DeliveryResult.failed("whatsapp credentials not configured");
    }
    try {
      final WhatsAppSendResponse response =
          call(
              () ->
                  whatsAppRestClient
                      .post()
                      .uri(properties.messagesPath())
                      .header(HttpHeaders.AUTHORIZATION, bearer())
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(payload)
                      .retrieve()
                      .body(WhatsAppSendResponse.class),
              "message send");
      if (response == null || response.messages().isEmpty()) {
        return DeliveryResult.failed(
            WhatsAppIntegrationException.Reason.INVALID_RESPONSE + ": no message id in reply");
      }
      return DeliveryResult.delivered(response.messages().get(0).id());
    } catch (WhatsAppIntegrationException ex) {
      logger.warn(
          "whatsapp send failed to={} type={} reason={}",
          payload.get("to"),
          payload.get("type"),
          ex.reason(),
          ex);
      return DeliveryResult.failed(ex.reason() + ": " + ex.getMessage());
    }
  }

  private <T> T call(Supplier<T> request, String operation) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (WhatsAppIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new WhatsAppIntegrationException(
          WhatsAppIntegrationException.Reason.INVALID_RESPONSE,
          "whatsapp " + operation + " response parse failed",
          ex);
    }
  }

  private Map<String, Object> basePayload(String to, String type) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("messaging_product", "whatsapp");
    payload.put("recipient_type", "individual");
    payload.put("to", PhoneNumbers.normalize(to, properties.defaultCountryCode()));
    payload.put("type", type);
    return payload;
  }

  private void requireConfigured() {
    if (!isConfigured()) {
      throw new WhatsAppIntegrationException(
          WhatsAppIntegrationException.Reason.UNAUTHORIZED, "whatsapp credentials not configured");
    }
  }

  private boolean isConfigured() {
    return !properties.accessToken().isBlank() && !properties.phoneNumberId().isBlank();
  }

  private String bearer() {
    return "Bearer " + properties.accessToken();
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }

  private WhatsAppIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    return statusFailure(ex.getStatusCode().value(), operation, ex);
  }

  private WhatsAppIntegrationException statusFailure(
      int status, String operation, Throwable cause) {
    if (status == 401 || status == 403) {
      return new WhatsAppIntegrationException(
          WhatsAppIntegrationException.Reason.UNAUTHORIZED,
          "whatsapp rejected credentials on " + operation,
          cause);
    }
    return new WhatsAppIntegrationException(
        WhatsAppIntegrationException.Reason.BAD_GATEWAY,
        "whatsapp " + operation + " failed with status " + status,
        cause);
  }

  private WhatsAppIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      return new WhatsAppIntegrationException(
          WhatsAppIntegrationException.Reason.TIMEOUT, "whatsapp " + operation + " timeout", ex);
    }
    return new WhatsAppIntegrationException(
        WhatsAppIntegrationException.Reason.BAD_GATEWAY,
        "whatsapp " + operation + " connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
