package com.nft.market.nft_market.error;

/**
 * Thrown when a ledger operation is rejected. The operation has been rolled
 * back entirely by the time this reaches the caller.
 */
public class MarketplaceException extends RuntimeException {

    private final ErrorKind kind;

    public MarketplaceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MarketplaceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static MarketplaceException notFound(String format, Object... args) {
        return new MarketplaceException(ErrorKind.NOT_FOUND, String.format(format, args));
    }

    public static MarketplaceException invalidState(String format, Object... args) {
        return new MarketplaceException(ErrorKind.INVALID_STATE, String.format(format, args));
    }

    public static MarketplaceException unauthorized(String format, Object... args) {
        return new MarketplaceException(ErrorKind.UNAUTHORIZED, String.format(format, args));
    }

    public static MarketplaceException insufficientFunds(String format, Object... args) {
        return new MarketplaceException(ErrorKind.INSUFFICIENT_FUNDS, String.format(format, args));
    }

    public static MarketplaceException ineligible(String format, Object... args) {
        return new MarketplaceException(ErrorKind.INELIGIBLE_ASSET, String.format(format, args));
    }

    public static MarketplaceException invalidParameters(String format, Object... args) {
        return new MarketplaceException(ErrorKind.INVALID_PARAMETERS, String.format(format, args));
    }

    public static MarketplaceException transferFailure(TransferException cause) {
        return new MarketplaceException(ErrorKind.TRANSFER_FAILURE, cause.getMessage(), cause);
    }
}
