package com.nft.market.nft_market.web;

import java.security.Principal;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.ledger.SaleLedger;
import com.nft.market.nft_market.web.dto.BuyRequest;
import com.nft.market.nft_market.web.dto.CreateSaleRequest;
import com.nft.market.nft_market.web.dto.SaleView;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/sales")
@RequiredArgsConstructor
public class SaleController {

    private final SaleLedger saleLedger;

    @PostMapping
    public ResponseEntity<Map<String, Long>> createSale(Principal principal,
            @Valid @RequestBody CreateSaleRequest request) {
        long saleId = saleLedger.createSale(CallerContexts.of(principal), request.getItem().toItemRef(),
                request.getAmount(), request.getStartTime(), request.getEndTime(),
                request.getPrice(), request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("saleId", saleId));
    }

    @GetMapping("/{saleId}")
    public SaleView getSale(@PathVariable long saleId) {
        return SaleView.of(saleLedger.getSale(saleId), saleLedger.getSaleStatus(saleId));
    }

    @GetMapping("/{saleId}/purchases/{buyer}")
    public Map<String, Long> purchasedBy(@PathVariable long saleId, @PathVariable String buyer) {
        return Map.of("purchased", saleLedger.purchasedBy(saleId, buyer));
    }

    @PostMapping("/{saleId}/buy")
    public Map<String, Boolean> buy(Principal principal,
            @RequestHeader(value = CallerContexts.ATTACHED_VALUE_HEADER, required = false) String attachedValue,
            @PathVariable long saleId,
            @RequestBody BuyRequest request) {
        boolean bought = saleLedger.buy(CallerContexts.of(principal, attachedValue), saleId,
                request.getRecipient(), request.getQuantity(), request.getAmountFromBalance());
        return Map.of("success", bought);
    }

    @PostMapping("/{saleId}/claim-items")
    public ResponseEntity<Void> claimItems(Principal principal, @PathVariable long saleId) {
        saleLedger.claimSaleNfts(CallerContexts.of(principal), saleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{saleId}/cancel")
    public ResponseEntity<Void> cancel(Principal principal, @PathVariable long saleId) {
        saleLedger.cancelSale(CallerContexts.of(principal), saleId);
        return ResponseEntity.noContent().build();
    }
}
