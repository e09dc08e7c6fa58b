package com.nft.market.nft_market.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class RateLimitFilterTest {

    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RateLimitFilter(new RateLimiterService(2, Duration.ofHours(1), Duration.ofHours(1), 1000));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private MockHttpServletResponse send(String method) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest(method, "/sales/1/buy"), response, new MockFilterChain());
        return response;
    }

    @Test
    void callerIsLimitedPerPeriod() throws Exception {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("0xa11c", null, List.of()));

        assertEquals(200, send("POST").getStatus());
        assertEquals(200, send("POST").getStatus());

        MockHttpServletResponse limited = send("POST");
        assertEquals(429, limited.getStatus());
        assertTrue(limited.getContentAsString().contains("caller:0xa11c"));

        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("0xb0b0", null, List.of()));
        assertEquals(200, send("POST").getStatus());
    }

    @Test
    void readsAreNotLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(new MockHttpServletRequest("GET", "/sales/1"), new MockHttpServletResponse(), chain);
            assertNotNull(chain.getRequest());
        }
    }

    @Test
    void limitedRequestDoesNotReachChain() throws Exception {
        send("POST");
        send("POST");

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(new MockHttpServletRequest("POST", "/vault/0x00"), new MockHttpServletResponse(), chain);
        assertNull(chain.getRequest());
    }
}
