package com.paperdex.app.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Writes one line per request: method, path, status, duration and the query parameters the
 * controller recorded under {@link #PARAMS_ATTRIBUTE}.
 */
@Log4j2
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  public static final String PARAMS_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".params";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    long t0 = System.nanoTime();
    try {
      chain.doFilter(request, response);
    } finally {
      long ms = (System.nanoTime() - t0) / 1_000_000;
      Object params = request.getAttribute(PARAMS_ATTRIBUTE);
      log.info(
          "http.request method={} path={} status={} durationMs={} params={}",
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          ms,
          params == null ? Map.of() : params);
    }
  }
}
