package com.nft.market.nft_market.error;

/**
 * Raised by payment rails and asset contracts when an external transfer fails.
 * The message is the counterparty's reason and is surfaced to the caller.
 */
public class TransferException extends RuntimeException {

    public TransferException(String reason) {
        super(reason);
    }

    public TransferException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
