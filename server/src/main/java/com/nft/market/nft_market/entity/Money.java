package com.nft.market.nft_market.entity;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-negative integer amount of value, expressed in base units of a currency.
 *
 * CRITICAL: ledger arithmetic never wraps around and never goes negative.
 * A subtraction that would underflow is an internal fault, not a value.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    public static final Money ZERO = new Money(BigInteger.ZERO);

    private final BigInteger units;

    private Money(BigInteger units) {
        this.units = units;
    }

    /**
     * Create Money from base units.
     */
    public static Money of(BigInteger units) {
        if (units == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (units.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + units);
        }
        return units.signum() == 0 ? ZERO : new Money(units);
    }

    public static Money of(long units) {
        return of(BigInteger.valueOf(units));
    }

    /**
     * Create Money from a decimal string of base units (safest for parsing user input).
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Money of(String units) {
        if (units == null || units.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return of(new BigInteger(units.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + units, e);
        }
    }

    public Money add(Money other) {
        return new Money(this.units.add(other.units));
    }

    /**
     * Subtract, failing loudly on underflow.
     *
     * @throws IllegalStateException if other is greater than this amount
     */
    public Money subtract(Money other) {
        BigInteger result = this.units.subtract(other.units);
        if (result.signum() < 0) {
            throw new IllegalStateException(
                String.format("Ledger underflow: %s - %s", this, other));
        }
        return of(result);
    }

    public Money multiply(long scalar) {
        if (scalar < 0) {
            throw new IllegalArgumentException("Scalar cannot be negative: " + scalar);
        }
        return of(this.units.multiply(BigInteger.valueOf(scalar)));
    }

    /**
     * Multiply by rate / scale, rounding toward zero.
     */
    public Money multiplyFloor(long rate, long scale) {
        if (scale <= 0) {
            throw new ArithmeticException("Scale must be positive");
        }
        return of(this.units.multiply(BigInteger.valueOf(rate)).divide(BigInteger.valueOf(scale)));
    }

    public boolean isZero() {
        return this.units.signum() == 0;
    }

    public boolean isPositive() {
        return this.units.signum() > 0;
    }

    public boolean isGreaterThan(Money other) {
        return this.compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqualTo(Money other) {
        return this.compareTo(other) >= 0;
    }

    /**
     * Get underlying units (for persistence/serialization only).
     */
    public BigInteger toBigInteger() {
        return units;
    }

    @Override
    public int compareTo(Money other) {
        return this.units.compareTo(other.units);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return units.equals(money.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(units);
    }

    @JsonValue
    @Override
    public String toString() {
        return units.toString();
    }
}
