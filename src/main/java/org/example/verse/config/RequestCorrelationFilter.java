package org.example.verse.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Echoes a well-formed {@code X-Request-Id} or assigns a fresh one, so verse requests and the
 * selections they trigger can be matched up in the logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelationFilter.class);

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(RequestCorrelation.HEADER_NAME);
        String requestId = RequestCorrelation.acceptIncoming(header);
        if (requestId == null) {
            requestId = RequestCorrelation.newRequestId();
            if (header != null && !header.isBlank()) {
                log.debug("Replaced malformed {} header with {}", RequestCorrelation.HEADER_NAME, requestId);
            }
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(RequestCorrelation.MDC_KEY, requestId)) {
            filterChain.doFilter(request, response);
        }
    }
}
