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

import com.nft.market.nft_market.entity.Bid;
import com.nft.market.nft_market.ledger.AuctionLedger;
import com.nft.market.nft_market.web.dto.AuctionView;
import com.nft.market.nft_market.web.dto.BidRequest;
import com.nft.market.nft_market.web.dto.CreateAuctionRequest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/auctions")
@RequiredArgsConstructor
public class AuctionController {

    private final AuctionLedger auctionLedger;

    @PostMapping
    public ResponseEntity<Map<String, Long>> createAuction(Principal principal,
            @Valid @RequestBody CreateAuctionRequest request) {
        long auctionId = auctionLedger.createAuction(CallerContexts.of(principal), request.getItem().toItemRef(),
                request.getStartTime(), request.getEndTime(), request.getReservePrice(), request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("auctionId", auctionId));
    }

    @GetMapping("/{auctionId}")
    public AuctionView getAuction(@PathVariable long auctionId) {
        return AuctionView.of(auctionLedger.getAuction(auctionId), auctionLedger.getAuctionStatus(auctionId));
    }

    @PostMapping("/{auctionId}/bids")
    public ResponseEntity<Void> bid(Principal principal,
            @RequestHeader(value = CallerContexts.ATTACHED_VALUE_HEADER, required = false) String attachedValue,
            @PathVariable long auctionId,
            @RequestBody BidRequest request) {
        auctionLedger.bid(CallerContexts.of(principal, attachedValue), auctionId,
                request.getAmountFromBalance(), request.getExternalFunds());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{auctionId}/bids/{bidder}")
    public Bid getBid(@PathVariable long auctionId, @PathVariable String bidder) {
        return auctionLedger.getBid(auctionId, bidder);
    }

    @GetMapping("/{auctionId}/highest-bidder")
    public Map<String, String> highestBidder(@PathVariable long auctionId) {
        return Map.of("highestBidder", auctionLedger.getHighestBidder(auctionId));
    }

    @PostMapping("/{auctionId}/claim")
    public ResponseEntity<Void> claim(Principal principal, @PathVariable long auctionId) {
        auctionLedger.claimAuctionItem(CallerContexts.of(principal), auctionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{auctionId}/cancel")
    public ResponseEntity<Void> cancel(Principal principal, @PathVariable long auctionId) {
        auctionLedger.cancelAuction(CallerContexts.of(principal), auctionId);
        return ResponseEntity.noContent().build();
    }
}
