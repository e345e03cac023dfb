package com.novaware.catalog.config;

import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Rejects /admin requests that do not carry the configured x-admin-key header.
 * When no key is configured every admin request is rejected.
 */
@Component
public class AdminKeyFilter implements WebFilter {
    public static final String HEADER = "x-admin-key";

    private final AppProperties appProperties;

    public AdminKeyFilter(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith("/admin")) {
            return chain.filter(exchange);
        }
        String key = exchange.getRequest().getHeaders().getFirst(HEADER);
        String expected = appProperties.getAdminKey();
        if (expected == null || expected.isBlank() || !expected.equals(key)) {
            return unauthorized(exchange.getResponse());
        }
        return chain.filter(exchange);
    }

    private Mono<Void> unauthorized(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        return response.setComplete();
    }
}
