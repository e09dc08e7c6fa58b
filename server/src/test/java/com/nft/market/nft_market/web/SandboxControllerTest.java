package com.nft.market.nft_market.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.nft.market.nft_market.asset.InMemoryAssetGateway;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.payment.InMemoryPaymentRails;

class SandboxControllerTest {

    private static final String CONTRACT = "0xc0de000000000000000000000000000000000721";
    private static final String OWNER = "0xa11c000000000000000000000000000000000011";
    private static final String TOKEN = "0x70c0000000000000000000000000000000000020";

    private InMemoryAssetGateway assets;
    private InMemoryPaymentRails rails;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        assets = new InMemoryAssetGateway();
        rails = new InMemoryPaymentRails("0x7ea5000000000000000000000000000000000003");
        mockMvc = MockMvcBuilders.standaloneSetup(new SandboxController(assets, rails))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void mintUniqueItemWithRoyaltySupport() throws Exception {
        mockMvc.perform(post("/sandbox/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item\":{\"contract\":\"" + CONTRACT + "\",\"itemId\":7,\"standard\":\"UNIQUE\"},"
                                + "\"owner\":\"" + OWNER + "\",\"royaltySupport\":true}"))
                .andExpect(status().isNoContent());

        assertEquals(OWNER, assets.ownerOf(CONTRACT, BigInteger.valueOf(7)));
        assertEquals(true, assets.supportsRoyaltyInfo(CONTRACT));
        mockMvc.perform(get("/sandbox/items/" + CONTRACT + "/7"))
                .andExpect(jsonPath("$.owner").value(OWNER));
    }

    @Test
    void quantityMintNeedsPositiveQuantity() throws Exception {
        mockMvc.perform(post("/sandbox/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item\":{\"contract\":\"" + CONTRACT + "\",\"itemId\":1,\"standard\":\"QUANTITY\"},"
                                + "\"owner\":\"" + OWNER + "\",\"quantity\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void fundAndApproveToken() throws Exception {
        mockMvc.perform(post("/sandbox/funds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"" + TOKEN + "\",\"account\":\"" + OWNER + "\",\"amount\":\"500\"}"))
                .andExpect(jsonPath("$.balance").value("500"));
        mockMvc.perform(post("/sandbox/allowances")
                        .principal(new UsernamePasswordAuthenticationToken(OWNER, null, List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"" + TOKEN + "\",\"amount\":\"200\"}"))
                .andExpect(status().isNoContent());

        assertEquals(Money.of(200), rails.allowanceOf(TOKEN, OWNER));
    }

    @Test
    void royaltyTermsApplyToSales() throws Exception {
        mockMvc.perform(put("/sandbox/contracts/" + CONTRACT + "/royalty")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver\":\"" + OWNER + "\",\"basisPoints\":250}"))
                .andExpect(status().isNoContent());

        assertEquals(Money.of(25), assets.royaltyInfo(CONTRACT, BigInteger.ONE, Money.of(1000)).getAmount());
    }
}
