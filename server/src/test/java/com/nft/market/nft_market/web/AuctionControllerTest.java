package com.nft.market.nft_market.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.nft.market.nft_market.entity.Bid;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.ledger.AuctionLedger;

class AuctionControllerTest {

    private static final String BIDDER = "0xa11c000000000000000000000000000000000011";

    private AuctionLedger auctionLedger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        auctionLedger = mock(AuctionLedger.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuctionController(auctionLedger))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void bidForwardsBothFundingSources() throws Exception {
        mockMvc.perform(post("/auctions/2/bids")
                        .principal(new UsernamePasswordAuthenticationToken(BIDDER, null, List.of()))
                        .header("X-Attached-Value", "150")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amountFromBalance\":\"200\",\"externalFunds\":\"150\"}"))
                .andExpect(status().isNoContent());

        ArgumentCaptor<CallContext> ctx = ArgumentCaptor.forClass(CallContext.class);
        verify(auctionLedger).bid(ctx.capture(), eq(2L), eq(Money.of(200)), eq(Money.of(150)));
        assertEquals(BIDDER, ctx.getValue().getCaller());
        assertEquals(Money.of(150), ctx.getValue().getAttachedValue());
    }

    @Test
    void losingBidIsPaymentRequired() throws Exception {
        doThrow(MarketplaceException.insufficientFunds("Bid %s must exceed highest bid %s", "200", "200"))
                .when(auctionLedger).bid(any(), eq(2L), any(), any());

        mockMvc.perform(post("/auctions/2/bids")
                        .principal(new UsernamePasswordAuthenticationToken(BIDDER, null, List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalFunds\":\"200\"}"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    void malformedAttachedValueIsBadRequest() throws Exception {
        mockMvc.perform(post("/auctions/2/bids")
                        .principal(new UsernamePasswordAuthenticationToken(BIDDER, null, List.of()))
                        .header("X-Attached-Value", "-5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void bidAndHighestBidderQueries() throws Exception {
        when(auctionLedger.getBid(2L, BIDDER)).thenReturn(new Bid(Money.of(300), 1500));
        when(auctionLedger.getHighestBidder(2L)).thenReturn(BIDDER);

        mockMvc.perform(get("/auctions/2/bids/" + BIDDER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value("300"))
                .andExpect(jsonPath("$.timestamp").value(1500));
        mockMvc.perform(get("/auctions/2/highest-bidder"))
                .andExpect(jsonPath("$.highestBidder").value(BIDDER));
    }

    @Test
    void claimAndCancelDelegate() throws Exception {
        UsernamePasswordAuthenticationToken seller = new UsernamePasswordAuthenticationToken(
                "0x5e11000000000000000000000000000000000010", null, List.of());

        mockMvc.perform(post("/auctions/2/claim").principal(seller)).andExpect(status().isNoContent());
        mockMvc.perform(post("/auctions/2/cancel").principal(seller)).andExpect(status().isNoContent());

        verify(auctionLedger).claimAuctionItem(any(), eq(2L));
        verify(auctionLedger).cancelAuction(any(), eq(2L));
    }
}
