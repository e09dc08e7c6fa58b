package com.nft.market.nft_market.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock the test moves by hand, in whole seconds.
 */
public class MutableClock extends Clock {

    private Instant instant;

    public MutableClock(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    public void set(long epochSecond) {
        instant = Instant.ofEpochSecond(epochSecond);
    }

    public void advance(long seconds) {
        instant = instant.plusSeconds(seconds);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
