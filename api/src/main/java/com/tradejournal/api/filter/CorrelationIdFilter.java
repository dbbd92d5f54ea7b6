package com.tradejournal.api.filter;

import com.tradejournal.application.service.CorrelationIdService;
import com.tradejournal.infrastructure.messaging.kafka.RelayHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Filter to extract and set correlation ID from HTTP headers
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private final CorrelationIdService correlationIdService;

    public CorrelationIdFilter(CorrelationIdService correlationIdService) {
        this.correlationIdService = correlationIdService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String correlationId = request.getHeader(RelayHeaders.CORRELATION_ID);
            if (correlationId != null && !correlationId.isEmpty()) {
                correlationIdService.setCorrelationId(correlationId);
            } else {
                correlationId = correlationIdService.generateCorrelationId();
            }

            response.setHeader(RelayHeaders.CORRELATION_ID, correlationId);
            filterChain.doFilter(request, response);
        } finally {
            correlationIdService.clear();
        }
    }
}
