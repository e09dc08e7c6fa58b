package com.nft.market.nft_market.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.entity.SaleStatus;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.error.TransferException;
import com.nft.market.nft_market.ledger.SaleLedger;

class SaleControllerTest {

    private static final String SELLER = "0x5e11000000000000000000000000000000000010";
    private static final String BUYER = "0xa11c000000000000000000000000000000000011";

    private SaleLedger saleLedger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        saleLedger = mock(SaleLedger.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SaleController(saleLedger))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static UsernamePasswordAuthenticationToken caller(String address) {
        return new UsernamePasswordAuthenticationToken(address, null, List.of());
    }

    @Test
    void createSaleReturnsId() throws Exception {
        when(saleLedger.createSale(any(), any(), eq(1L), eq(1000L), eq(2000L), eq(Money.of(100)), eq("0x00")))
                .thenReturn(5L);

        mockMvc.perform(post("/sales")
                        .principal(caller(SELLER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item\":{\"contract\":\"0xC0DE\",\"itemId\":1,\"standard\":\"UNIQUE\"},"
                                + "\"amount\":1,\"startTime\":1000,\"endTime\":2000,\"price\":\"100\",\"currency\":\"0x00\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.saleId").value(5));

        ArgumentCaptor<CallContext> ctx = ArgumentCaptor.forClass(CallContext.class);
        ArgumentCaptor<ItemRef> item = ArgumentCaptor.forClass(ItemRef.class);
        verify(saleLedger).createSale(ctx.capture(), item.capture(), eq(1L), eq(1000L), eq(2000L),
                eq(Money.of(100)), eq("0x00"));
        assertEquals(SELLER, ctx.getValue().getCaller());
        assertEquals("0xc0de", item.getValue().getContract());
    }

    @Test
    void missingItemIsBadRequest() throws Exception {
        mockMvc.perform(post("/sales")
                        .principal(caller(SELLER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1,\"price\":\"100\",\"currency\":\"0x00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETERS"));
    }

    @Test
    void buyPassesAttachedValue() throws Exception {
        when(saleLedger.buy(any(), eq(3L), isNull(), eq(2L), eq(Money.of(10)))).thenReturn(true);

        mockMvc.perform(post("/sales/3/buy")
                        .principal(caller(BUYER))
                        .header("X-Attached-Value", "190")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":2,\"amountFromBalance\":\"10\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<CallContext> ctx = ArgumentCaptor.forClass(CallContext.class);
        verify(saleLedger).buy(ctx.capture(), eq(3L), isNull(), eq(2L), eq(Money.of(10)));
        assertEquals(Money.of(190), ctx.getValue().getAttachedValue());
    }

    @Test
    void errorKindsMapToStatuses() throws Exception {
        doThrow(MarketplaceException.invalidState("Sale %d is %s", 3, "ENDED"))
                .when(saleLedger).cancelSale(any(), eq(3L));
        doThrow(MarketplaceException.unauthorized("nope"))
                .when(saleLedger).claimSaleNfts(any(), eq(3L));
        when(saleLedger.buy(any(), eq(4L), any(), anyLong(), any()))
                .thenThrow(MarketplaceException.transferFailure(new TransferException("paused")));

        mockMvc.perform(post("/sales/3/cancel").principal(caller(SELLER)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"))
                .andExpect(jsonPath("$.message").value("Sale 3 is ENDED"));
        mockMvc.perform(post("/sales/3/claim-items").principal(caller(SELLER)))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/sales/4/buy").principal(caller(BUYER))
                        .contentType(MediaType.APPLICATION_JSON).content("{\"quantity\":1}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("paused"));
    }

    @Test
    void getSaleShowsStatusAndRemaining() throws Exception {
        Sale sale = Sale.builder()
                .id(3)
                .item(ItemRef.of("0xc0de", BigInteger.ONE, ItemStandard.QUANTITY))
                .seller(SELLER)
                .price(Money.of(25))
                .currency("0x00")
                .amount(10)
                .purchased(4)
                .startTime(1000)
                .endTime(2000)
                .build();
        when(saleLedger.getSale(3L)).thenReturn(sale);
        when(saleLedger.getSaleStatus(3L)).thenReturn(SaleStatus.ACTIVE);

        mockMvc.perform(get("/sales/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.remaining").value(6))
                .andExpect(jsonPath("$.price").value("25"));
    }

    @Test
    void unknownSaleIsNotFound() throws Exception {
        when(saleLedger.getSale(9L)).thenThrow(MarketplaceException.notFound("Sale %d does not exist", 9));

        mockMvc.perform(get("/sales/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }
}
