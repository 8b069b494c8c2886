package com.example.studio.observability.filter;

import com.example.studio.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation id, ahead of the security chain so that
 * rejections and scope audit events carry it too.
 *
 * <p>The id is taken from {@code X-Correlation-Id} or {@code X-Request-Id} when
 * it is well formed, otherwise generated. It is echoed on the response, written
 * back onto the request, and put in both the Reactor context and the MDC.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(headers -> headers.set(CORRELATION_ID_HEADER, correlationId))
                .build();

        return chain.filter(exchange.mutate().request(mutatedRequest).build())
                .contextWrite(Context.of(
                        CORRELATION_ID_KEY, correlationId,
                        REQUEST_PATH_KEY, requestPath
                ))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    MDC.put(REQUEST_PATH_KEY, requestPath);
                    log.debug("Request started: {} {}", requestMethod, StringSanitizer.forLog(requestPath, 200));
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}",
                            requestMethod, StringSanitizer.forLog(requestPath, 200), signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(REQUEST_PATH_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = trimmed(request.getHeaders().getFirst(CORRELATION_ID_HEADER));
        if (StringSanitizer.isValidCorrelationId(correlationId)) {
            return correlationId;
        }

        String requestId = trimmed(request.getHeaders().getFirst(REQUEST_ID_HEADER));
        if (StringSanitizer.isValidCorrelationId(requestId)) {
            return requestId;
        }

        return UUID.randomUUID().toString();
    }

    private static String trimmed(String value) {
        return value != null ? value.trim() : null;
    }
}
