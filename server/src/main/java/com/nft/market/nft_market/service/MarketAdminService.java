package com.nft.market.nft_market.service;

import org.springframework.stereotype.Service;

import com.nft.market.nft_market.engine.FeePolicy;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.registry.EligibilityRegistry;
import com.nft.market.nft_market.security.AccessPolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrator-only configuration of fees and eligibility.
 *
 * Every setter returns whether anything changed; repeating a call with the
 * current value is accepted and does nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAdminService {

    private final FeePolicy feePolicy;
    private final EligibilityRegistry eligibilityRegistry;
    private final AccessPolicy accessPolicy;

    public boolean setFee(CallContext ctx, long rate, long scale) {
        requireAdministrator(ctx, "setFee");
        return feePolicy.setFee(rate, scale);
    }

    public boolean setFeeRecipient(CallContext ctx, String recipient) {
        requireAdministrator(ctx, "setFeeRecipient");
        return feePolicy.setFeeRecipient(recipient);
    }

    public boolean setListingContractApproval(CallContext ctx, String contract, boolean approved) {
        requireAdministrator(ctx, "setListingContractApproval");
        return eligibilityRegistry.setListingContractApproval(contract, approved);
    }

    public boolean setCurrencyApproval(CallContext ctx, String currency, boolean approved) {
        requireAdministrator(ctx, "setCurrencyApproval");
        return eligibilityRegistry.setCurrencyApproval(currency, approved);
    }

    public boolean approveAllCurrencies(CallContext ctx) {
        requireAdministrator(ctx, "approveAllCurrencies");
        return eligibilityRegistry.approveAllCurrencies();
    }

    private void requireAdministrator(CallContext ctx, String operation) {
        if (!accessPolicy.isAdministrator(ctx.getCaller())) {
            log.warn("Rejected {}: caller={} is not an administrator", operation, ctx.getCaller());
            throw MarketplaceException.unauthorized("%s requires an administrator", operation);
        }
    }
}
