package com.nft.market.nft_market.web;

import java.security.Principal;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.ledger.ClaimVault;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/vault")
@RequiredArgsConstructor
public class VaultController {

    private final ClaimVault claimVault;

    /**
     * Claimable balance of the given account, or of the caller when omitted.
     */
    @GetMapping("/{currency}")
    public Map<String, Money> balance(Principal principal, @PathVariable String currency,
            @RequestParam(required = false) String account) {
        String owner = account != null ? account : principal != null ? principal.getName() : null;
        if (owner == null) {
            throw MarketplaceException.invalidParameters("Account is required");
        }
        return Map.of("balance", claimVault.balanceOf(owner, currency));
    }

    @PostMapping("/{currency}")
    public Map<String, Money> claim(Principal principal, @PathVariable String currency) {
        return Map.of("claimed", claimVault.claim(CallerContexts.of(principal), currency));
    }
}
