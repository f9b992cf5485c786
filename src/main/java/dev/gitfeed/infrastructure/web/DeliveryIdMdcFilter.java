package dev.gitfeed.infrastructure.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Copies GitHub's delivery id into the MDC so every log line of a webhook request
 * can be matched to the delivery shown in the repository's webhook settings.
 */
@Component
public class DeliveryIdMdcFilter extends OncePerRequestFilter {

    public static final String DELIVERY_HEADER = "X-GitHub-Delivery";
    public static final String MDC_KEY = "deliveryId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String deliveryId = request.getHeader(DELIVERY_HEADER);
        if (deliveryId == null || deliveryId.isBlank()) {
            chain.doFilter(request, response);
            return;
        }
        MDC.put(MDC_KEY, deliveryId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
