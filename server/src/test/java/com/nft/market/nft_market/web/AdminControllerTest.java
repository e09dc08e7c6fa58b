package com.nft.market.nft_market.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.nft.market.nft_market.engine.FeePolicy;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.security.ConfiguredAccessPolicy;
import com.nft.market.nft_market.service.MarketAdminService;

class AdminControllerTest {

    private static final String ADMIN = "0xad01000000000000000000000000000000000005";
    private static final String USER = "0xa11c000000000000000000000000000000000011";
    private static final String CONTRACT = "0xc0de000000000000000000000000000000000721";

    private FeePolicy feePolicy;
    private EligibilityRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        feePolicy = new FeePolicy(300, 10_000, "0xfee0000000000000000000000000000000000004");
        registry = new EligibilityRegistry();
        MarketAdminService service = new MarketAdminService(feePolicy, registry,
                new ConfiguredAccessPolicy(List.of(ADMIN)));
        mockMvc = MockMvcBuilders.standaloneSetup(new AdminController(service, feePolicy, registry))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static UsernamePasswordAuthenticationToken caller(String address) {
        return new UsernamePasswordAuthenticationToken(address, null, List.of());
    }

    @Test
    void feeIsReadable() throws Exception {
        mockMvc.perform(get("/admin/fee"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rate").value(300))
                .andExpect(jsonPath("$.scale").value(10000));
    }

    @Test
    void onlyAdministratorSetsFee() throws Exception {
        mockMvc.perform(put("/admin/fee").principal(caller(USER))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"rate\":1,\"scale\":100}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(put("/admin/fee").principal(caller(ADMIN))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"rate\":1,\"scale\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true));
        assertEquals(1, feePolicy.getFeeRate());

        mockMvc.perform(put("/admin/fee").principal(caller(ADMIN))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"rate\":101,\"scale\":100}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void repeatedApprovalIsNoOp() throws Exception {
        for (boolean expected : new boolean[] { true, false }) {
            mockMvc.perform(put("/admin/listing-contracts/" + CONTRACT).principal(caller(ADMIN))
                            .contentType(MediaType.APPLICATION_JSON).content("{\"approved\":true}"))
                    .andExpect(jsonPath("$.changed").value(expected));
        }
        mockMvc.perform(get("/admin/listing-contracts/" + CONTRACT))
                .andExpect(jsonPath("$.approved").value(true));
    }

    @Test
    void approveAllCurrencies() throws Exception {
        mockMvc.perform(post("/admin/currencies/approve-all").principal(caller(ADMIN)))
                .andExpect(jsonPath("$.changed").value(true));
        mockMvc.perform(get("/admin/currencies/0x1234"))
                .andExpect(jsonPath("$.approved").value(true));
    }
}
