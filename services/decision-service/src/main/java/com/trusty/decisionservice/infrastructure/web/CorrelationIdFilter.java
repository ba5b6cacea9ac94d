package com.trusty.decisionservice.infrastructure.web;

import com.trusty.observability.CorrelationContext;
import com.trusty.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the correlation scope of an HTTP request.
 *
 * <p>An inbound {@code X-Correlation-ID} is accepted only if it is a short token of letters,
 * digits and {@code . _ : -}; anything else (absent, blank, too long, or carrying characters that
 * could forge log lines) is replaced by a fresh UUID. The accepted id is echoed in the response.
 *
 * <p>The request starts with a correlation-only context: the actor and namespace MDC keys stay
 * empty until {@code DecisionService} narrows the scope for the duration of one decision. Admin
 * calls never carry them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final int MAX_CORRELATION_ID_LENGTH = 128;

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = correlationIdOf(request);
        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    static String correlationIdOf(HttpServletRequest request) {
        String inbound = request.getHeader(CORRELATION_ID_HEADER);
        if (inbound == null || inbound.isBlank()) {
            return UUID.randomUUID().toString();
        }
        if (inbound.length() > MAX_CORRELATION_ID_LENGTH
                || !ACCEPTED_ID.matcher(inbound).matches()) {
            String replacement = UUID.randomUUID().toString();
            log.debug(
                    "Replaced malformed {} header ({} chars) with {}",
                    CORRELATION_ID_HEADER,
                    inbound.length(),
                    replacement);
            return replacement;
        }
        return inbound;
    }
}
