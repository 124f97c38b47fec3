package com.example.catalog.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the seller-app back end and operator tooling by a shared token header. Forwarded
 * roles are honoured only when the token is valid.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";
  private static final List<String> PROTECTED_PREFIXES =
      List.of("/sellers", "/listings", "/admin");

  private final CatalogInternalApiProperties properties;

  public InternalApiAuthenticationFilter(CatalogInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isInternalProtectedPath(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String actualToken = request.getHeader(properties.headerName());
    if (isValidInternalToken(actualToken)) {
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              "seller-app-internal",
              "N/A",
              buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for protected path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isInternalProtectedPath(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    if (uri == null) {
      return false;
    }
    for (String prefix : PROTECTED_PREFIXES) {
      if (uri.equals(prefix) || uri.startsWith(prefix + "/")) {
        return true;
      }
    }
    return false;
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && actualToken.equals(properties.token())
        && !properties.token().isBlank();
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));

    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }

    for (String role : forwardedRoles.split(",")) {
      final String normalized = role.trim();
      if ("ADMIN".equals(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
      }
    }
    return authorities;
  }
}
