package com.example.catalog.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.whatsapp")
public record WhatsAppProperties(
    String baseUrl,
    String apiVersion,
    String phoneNumberId,
    String accessToken,
    String verifyToken,
    Duration connectTimeout,
    Duration readTimeout,
    String defaultCountryCode) {

  public WhatsAppProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://graph.facebook.com" : baseUrl;
    apiVersion = apiVersion == null || apiVersion.isBlank() ? "v18.0" : apiVersion;
    phoneNumberId = phoneNumberId == null ? "" : phoneNumberId;
    accessToken = accessToken == null ? "" : accessToken;
    verifyToken = verifyToken == null ? "" : verifyToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(30) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    defaultCountryCode =
        defaultCountryCode == null || defaultCountryCode.isBlank() ? "1" : defaultCountryCode;
  }

  public String messagesPath() {
    return "/" + apiVersion + "/" + phoneNumberId + "/messages";
  }

  public String mediaPath() {
    return "/" + apiVersion + "/{mediaId}";
  }
}
