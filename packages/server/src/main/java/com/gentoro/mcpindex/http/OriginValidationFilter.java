package com.gentoro.mcpindex.http;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects requests whose {@code Origin} or {@code Host} names a host outside the allow-list, which
 * blocks DNS-rebinding attacks against a locally bound server. Requests without an {@code Origin}
 * header are admitted; loopback names are always allowed.
 */
public class OriginValidationFilter implements Filter {
  private static final org.slf4j.Logger log =
      com.gentoro.mcpindex.logging.LoggingService.getLogger(OriginValidationFilter.class);

  private static final Set<String> LOOPBACK = Set.of("localhost", "127.0.0.1", "::1");

  private final Set<String> allowedHosts;

  public OriginValidationFilter(Collection<String> allowedHosts) {
    Set<String> hosts = new LinkedHashSet<>(LOOPBACK);
    for (String h : allowedHosts) {
      if (h != null && !h.isBlank()) {
        hosts.add(h.trim().toLowerCase(Locale.ROOT));
      }
    }
    this.allowedHosts = Set.copyOf(hosts);
  }

  public Set<String> allowedHosts() {
    return allowedHosts;
  }

  @Override
  public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
      throws IOException, ServletException {
    HttpServletRequest request = (HttpServletRequest) req;
    HttpServletResponse response = (HttpServletResponse) res;

    String host = request.getHeader("Host");
    if (host != null && !isAllowed(hostOfHostHeader(host))) {
      reject(response, "Invalid host header", host);
      return;
    }
    String origin = request.getHeader("Origin");
    if (origin != null && !isAllowed(hostOfOrigin(origin))) {
      reject(response, "Invalid origin header", origin);
      return;
    }
    chain.doFilter(req, res);
  }

  boolean isAllowed(String host) {
    return host != null && allowedHosts.contains(host.toLowerCase(Locale.ROOT));
  }

  static String hostOfOrigin(String origin) {
    try {
      String host = URI.create(origin.trim()).getHost();
      if (host != null && host.startsWith("[") && host.endsWith("]")) {
        host = host.substring(1, host.length() - 1);
      }
      return host;
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  static String hostOfHostHeader(String host) {
    String h = host.trim();
    if (h.startsWith("[")) {
      int end = h.indexOf(']');
      return end > 0 ? h.substring(1, end) : null;
    }
    int colon = h.indexOf(':');
    return colon >= 0 ? h.substring(0, colon) : h;
  }

  private static void reject(HttpServletResponse response, String message, String value)
      throws IOException {
    log.warn("Rejected request: {} '{}'", message, value);
    response.setStatus(HttpServletResponse.SC_FORBIDDEN);
    response.setContentType("text/plain;charset=UTF-8");
    response.getWriter().write(message);
  }
}
