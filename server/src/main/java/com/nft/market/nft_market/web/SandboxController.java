package com.nft.market.nft_market.web;

import java.math.BigInteger;
import java.security.Principal;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.asset.InMemoryAssetGateway;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.payment.InMemoryPaymentRails;
import com.nft.market.nft_market.web.dto.FundsRequest;
import com.nft.market.nft_market.web.dto.MintItemRequest;
import com.nft.market.nft_market.web.dto.RoyaltyRequest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Minting and wallet funding against the in-memory collaborators.
 * Only mapped with {@code marketplace.sandbox.enabled=true}.
 */
@Slf4j
@RestController
@RequestMapping("/sandbox")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "marketplace.sandbox", name = "enabled", havingValue = "true")
public class SandboxController {

    private final InMemoryAssetGateway assetGateway;
    private final InMemoryPaymentRails paymentRails;

    @PostMapping("/items")
    public ResponseEntity<Void> mint(@Valid @RequestBody MintItemRequest request) {
        ItemRef item = request.getItem().toItemRef();
        assetGateway.registerContract(item.getContract(), request.isRoyaltySupport());
        if (item.getStandard() == ItemStandard.UNIQUE) {
            assetGateway.mintUnique(item.getContract(), item.getItemId(), request.getOwner());
        } else {
            if (request.getQuantity() <= 0) {
                throw new IllegalArgumentException("Quantity must be positive: " + request.getQuantity());
            }
            assetGateway.mintQuantity(item.getContract(), item.getItemId(), request.getOwner(), request.getQuantity());
        }
        log.info("Sandbox mint: item={}, owner={}, qty={}", item, request.getOwner(), request.getQuantity());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/items/{contract}/{itemId}")
    public Map<String, Object> holdings(@PathVariable String contract, @PathVariable BigInteger itemId,
            @RequestParam(required = false) String owner) {
        String uniqueOwner = assetGateway.ownerOf(contract, itemId);
        if (owner == null) {
            return Map.of("owner", uniqueOwner == null ? Addresses.ZERO : uniqueOwner);
        }
        return Map.of("balance", assetGateway.balanceOf(contract, itemId, owner));
    }

    @PutMapping("/contracts/{contract}/royalty")
    public ResponseEntity<Void> setRoyalty(@PathVariable String contract, @Valid @RequestBody RoyaltyRequest request) {
        assetGateway.registerContract(contract, true);
        assetGateway.setRoyalty(contract, request.getReceiver(), request.getBasisPoints());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/funds")
    public Map<String, Money> fund(@Valid @RequestBody FundsRequest request) {
        String account = request.getAccount() != null ? request.getAccount() : paymentRails.getTreasury();
        paymentRails.mint(request.getCurrency(), account, request.getAmount());
        return Map.of("balance", paymentRails.balanceOf(request.getCurrency(), account));
    }

    /**
     * Caller lets the treasury pull up to amount of a token.
     */
    @PostMapping("/allowances")
    public ResponseEntity<Void> approve(Principal principal, @Valid @RequestBody FundsRequest request) {
        String owner = CallerContexts.of(principal).getCaller();
        paymentRails.approve(request.getCurrency(), owner, request.getAmount());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/wallets/{currency}/{account}")
    public Map<String, Money> wallet(@PathVariable String currency, @PathVariable String account) {
        return Map.of("balance", paymentRails.balanceOf(currency, account));
    }
}
