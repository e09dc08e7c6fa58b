package com.nft.market.nft_market.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.jayway.jsonpath.JsonPath;
import com.nft.market.nft_market.security.CallerTokenService;

class SandboxTokenControllerTest {

    private static final String ALICE = "0xa11c000000000000000000000000000000000011";

    private final CallerTokenService tokens = new CallerTokenService("test-secret-0123456789abcdef0123456789",
            Duration.ofHours(1), Clock.systemUTC());
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new SandboxTokenController(tokens))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

    @Test
    void issuedTokenAuthenticatesTheAccount() throws Exception {
        String body = mockMvc.perform(post("/sandbox/tokens")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"account\":\"" + ALICE + "\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        String token = JsonPath.read(body, "$.token");
        assertEquals(ALICE, tokens.validateToken(token));
    }

    @Test
    void zeroAddressIsRejected() throws Exception {
        mockMvc.perform(post("/sandbox/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"account\":\"0x0000000000000000000000000000000000000000\"}"))
                .andExpect(status().isBadRequest());
    }
}
