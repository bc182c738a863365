package com.github.dimitryivaniuta.monetize.money;

import com.github.dimitryivaniuta.monetize.currency.CurrencyContext;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Amount in currency subunits (cents for USD) with its ISO code.
 * Integral unless produced with infinite precision. Subunits are kept at their smallest
 * non-negative scale, so equal amounts are {@code equals} however they were built.
 */
public record ParsedMoney(BigDecimal subunits, String currency) {

    public ParsedMoney {
        if (subunits == null) throw new IllegalArgumentException("subunits is null");
        if (currency == null || currency.isBlank()) throw new IllegalArgumentException("currency must not be blank");
        subunits = subunits.stripTrailingZeros();
        if (subunits.scale() < 0) subunits = subunits.setScale(0);
    }

    public static ParsedMoney of(BigInteger subunits, String currency) {
        return new ParsedMoney(new BigDecimal(subunits), currency);
    }

    /** @throws ArithmeticException if a fractional subunit was kept */
    public BigInteger subunitsExact() { return subunits.toBigIntegerExact(); }

    public boolean isNegative() { return subunits.signum() < 0; }

    /** Major-unit projection at the currency's decimal places, e.g. 123456 USD -> 1234.56. */
    public BigDecimal asDecimal(CurrencyContext ctx) {
        return subunits.divide(BigDecimal.valueOf(ctx.subunitToUnit()), ctx.decimalPlaces(), RoundingMode.HALF_UP);
    }
}
