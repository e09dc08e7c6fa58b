package com.nft.market.nft_market.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.nft.market.nft_market.engine.FeePolicy;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings under the {@code marketplace} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    /**
     * Listing-contract address of the sale ledger; also its custody address.
     */
    private String saleLedgerAddress = "0x5a1e000000000000000000000000000000000001";

    private String auctionLedgerAddress = "0xa0c7000000000000000000000000000000000002";

    /**
     * Treasury wallet holding collected value.
     */
    private String treasuryAddress = "0x7ea5000000000000000000000000000000000003";

    private List<String> admins = new ArrayList<>();

    private Fee fee = new Fee();

    private Eligibility eligibility = new Eligibility();

    private RateLimit rateLimit = new RateLimit();

    private Auth auth = new Auth();

    @Getter
    @Setter
    public static class Fee {
        private long rate = FeePolicy.DEFAULT_FEE_RATE;
        private long scale = FeePolicy.DEFAULT_FEE_SCALE;
        private String recipient = "0xfee0000000000000000000000000000000000004";
    }

    @Getter
    @Setter
    public static class Eligibility {
        /**
         * Item contracts approved at startup. The ledgers approve themselves.
         */
        private List<String> listingContracts = new ArrayList<>();
        private List<String> currencies = new ArrayList<>();
        private boolean approveAllCurrencies = false;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int limitForPeriod = 10;
        private Duration refreshPeriod = Duration.ofSeconds(1);
        private Duration idleExpiry = Duration.ofMinutes(10);
        private long maxCallers = 100_000;
    }

    @Getter
    @Setter
    public static class Auth {
        /**
         * HS256 signing secret for caller tokens, at least 32 bytes.
         */
        private String tokenSecret;
        private Duration tokenTtl = Duration.ofHours(1);
    }
}
