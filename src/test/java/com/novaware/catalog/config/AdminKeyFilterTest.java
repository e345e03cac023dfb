package com.novaware.catalog.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class AdminKeyFilterTest {

    private static AdminKeyFilter filter(String key) {
        AppProperties props = new AppProperties();
        props.setAdminKey(key);
        return new AdminKeyFilter(props);
    }

    private static boolean passes(AdminKeyFilter filter, MockServerWebExchange exchange) {
        AtomicBoolean called = new AtomicBoolean();
        WebFilterChain chain = ex -> {
            called.set(true);
            return Mono.empty();
        };
        filter.filter(exchange, chain).block();
        return called.get();
    }

    @Test
    public void adminPathsNeedTheKey() {
        MockServerWebExchange noKey = MockServerWebExchange.from(MockServerHttpRequest.post("/admin/pipeline/resolve"));
        assertFalse(passes(filter("s3cret"), noKey));
        assertEquals(HttpStatus.UNAUTHORIZED, noKey.getResponse().getStatusCode());

        MockServerWebExchange withKey = MockServerWebExchange.from(
                MockServerHttpRequest.post("/admin/pipeline/resolve").header(AdminKeyFilter.HEADER, "s3cret"));
        assertTrue(passes(filter("s3cret"), withKey));
    }

    @Test
    public void unconfiguredKeyLocksAdminPaths() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/admin/runs/latest").header(AdminKeyFilter.HEADER, ""));
        assertFalse(passes(filter(null), exchange));
    }

    @Test
    public void otherPathsPassThrough() {
        assertTrue(passes(filter("s3cret"), MockServerWebExchange.from(MockServerHttpRequest.get("/v3/api-docs"))));
    }
}
