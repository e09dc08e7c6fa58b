package com.nft.market.nft_market.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Clock;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class CallerAuthenticationFilterTest {

    private static final String ADMIN = "0xad01000000000000000000000000000000000005";

    private final CallerTokenService tokens = new CallerTokenService(CallerTokenServiceTest.SECRET,
            Duration.ofHours(1), Clock.systemUTC());
    private final CallerAuthenticationFilter filter = new CallerAuthenticationFilter(tokens);

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void bearerTokenBecomesPrincipal() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/sales");
        request.addHeader("Authorization", "Bearer " + tokens.issue(ADMIN));

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertEquals(ADMIN, auth.getName());
    }

    @Test
    void claimedAddressHeaderIsIgnored() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/admin/fee");
        request.addHeader("X-Caller-Address", ADMIN);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void invalidOrMissingTokenStaysAnonymous() throws Exception {
        filter.doFilter(new MockHttpServletRequest("POST", "/sales"), new MockHttpServletResponse(),
                new MockFilterChain());
        assertNull(SecurityContextHolder.getContext().getAuthentication());

        MockHttpServletRequest tampered = new MockHttpServletRequest("POST", "/sales");
        tampered.addHeader("Authorization", "Bearer " + tokens.issue(ADMIN) + "x");
        filter.doFilter(tampered, new MockHttpServletResponse(), new MockFilterChain());
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
