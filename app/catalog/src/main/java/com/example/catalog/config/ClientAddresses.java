package com.example.catalog.config;

import com.example.catalog.model.NetworkMetadata;
import jakarta.servlet.http.HttpServletRequest;

/** Resolves the caller's network identity, honouring the first X-Forwarded-For hop. */
public final class ClientAddresses {

  private ClientAddresses() {}

  public static String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }

  public static NetworkMetadata networkMetadata(HttpServletRequest request) {
    return new NetworkMetadata(resolveClientIp(request), request.getHeader("User-Agent"));
  }
}
