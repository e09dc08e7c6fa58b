package com.nft.market.nft_market.entity;

import lombok.Getter;

/**
 * Who is calling, and how much native value they attached to the call.
 */
@Getter
public class CallContext {
    private final String caller;
    private final Money attachedValue;

    public CallContext(String caller, Money attachedValue) {
        this.caller = Addresses.normalize(caller);
        this.attachedValue = attachedValue != null ? attachedValue : Money.ZERO;
    }

    public static CallContext of(String caller) {
        return new CallContext(caller, Money.ZERO);
    }

    public static CallContext of(String caller, Money attachedValue) {
        return new CallContext(caller, attachedValue);
    }
}
