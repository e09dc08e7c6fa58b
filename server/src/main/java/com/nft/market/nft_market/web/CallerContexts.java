package com.nft.market.nft_market.web;

import java.security.Principal;

import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.MarketplaceException;

final class CallerContexts {

    static final String ATTACHED_VALUE_HEADER = "X-Attached-Value";

    private CallerContexts() {
    }

    static CallContext of(Principal principal, String attachedValue) {
        if (principal == null) {
            throw MarketplaceException.unauthorized("Caller address is required");
        }
        Money value = attachedValue == null || attachedValue.isBlank() ? Money.ZERO : Money.of(attachedValue);
        return CallContext.of(principal.getName(), value);
    }

    static CallContext of(Principal principal) {
        return of(principal, null);
    }
}
