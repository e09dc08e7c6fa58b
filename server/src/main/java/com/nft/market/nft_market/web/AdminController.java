package com.nft.market.nft_market.web;

import java.security.Principal;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.engine.FeePolicy;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.service.MarketAdminService;
import com.nft.market.nft_market.web.dto.ApprovalRequest;
import com.nft.market.nft_market.web.dto.FeeRecipientRequest;
import com.nft.market.nft_market.web.dto.FeeRequest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Fee and eligibility settings. Reads are public, writes need an administrator.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final MarketAdminService adminService;
    private final FeePolicy feePolicy;
    private final EligibilityRegistry eligibilityRegistry;

    @GetMapping("/fee")
    public Map<String, Object> fee() {
        return Map.of(
                "rate", feePolicy.getFeeRate(),
                "scale", feePolicy.getFeeScale(),
                "recipient", feePolicy.getFeeRecipient());
    }

    @PutMapping("/fee")
    public Map<String, Boolean> setFee(Principal principal, @RequestBody FeeRequest request) {
        return changed(adminService.setFee(CallerContexts.of(principal), request.getRate(), request.getScale()));
    }

    @PutMapping("/fee-recipient")
    public Map<String, Boolean> setFeeRecipient(Principal principal, @Valid @RequestBody FeeRecipientRequest request) {
        return changed(adminService.setFeeRecipient(CallerContexts.of(principal), request.getRecipient()));
    }

    @GetMapping("/listing-contracts/{contract}")
    public Map<String, Boolean> listingContract(@PathVariable String contract) {
        return Map.of("approved", eligibilityRegistry.isApprovedListingContract(contract));
    }

    @PutMapping("/listing-contracts/{contract}")
    public Map<String, Boolean> setListingContract(Principal principal, @PathVariable String contract,
            @RequestBody ApprovalRequest request) {
        return changed(adminService.setListingContractApproval(
                CallerContexts.of(principal), contract, request.isApproved()));
    }

    @GetMapping("/currencies/{currency}")
    public Map<String, Boolean> currency(@PathVariable String currency) {
        return Map.of("approved", eligibilityRegistry.isApprovedCurrency(currency));
    }

    @PutMapping("/currencies/{currency}")
    public Map<String, Boolean> setCurrency(Principal principal, @PathVariable String currency,
            @RequestBody ApprovalRequest request) {
        return changed(adminService.setCurrencyApproval(CallerContexts.of(principal), currency, request.isApproved()));
    }

    @PostMapping("/currencies/approve-all")
    public Map<String, Boolean> approveAllCurrencies(Principal principal) {
        return changed(adminService.approveAllCurrencies(CallerContexts.of(principal)));
    }

    private static Map<String, Boolean> changed(boolean changed) {
        return Map.of("changed", changed);
    }
}
