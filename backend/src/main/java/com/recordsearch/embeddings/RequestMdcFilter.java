package com.recordsearch.embeddings;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Puts the caller and a correlation id into the logging context for the duration of a request.
 * The correlation id is taken from the request header or generated, and echoed on the response.
 */
@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String USERNAME_MDC_KEY = "username";
  static final String USERNAME_HEADER = "X-Username";
  static final String DEFAULT_USERNAME = "anonymous";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String username = request.getHeader(USERNAME_HEADER);
      if (username == null || username.isBlank()) {
        username = DEFAULT_USERNAME;
      }
      MDC.put(USERNAME_MDC_KEY, username);

      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId == null || correlationId.isBlank()) {
        correlationId = UUID.randomUUID().toString();
      }
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(USERNAME_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
