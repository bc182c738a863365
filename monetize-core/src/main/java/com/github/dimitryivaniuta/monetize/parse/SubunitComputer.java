package com.github.dimitryivaniuta.monetize.parse;

import com.github.dimitryivaniuta.monetize.currency.CurrencyContext;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Turns split digits into a signed subunit count for a currency.
 *
 * <p>A multiplier pulls the first {@code exponent} fraction digits up into whole
 * subunits, counted at 100 subunits per shifted value whatever the currency's own ratio.
 * Currencies with other than two decimal places get unusual results with K/M/B/T
 * suffixes; that behaviour is kept as-is.
 */
public final class SubunitComputer {

    private static final BigInteger SHIFT_SUBUNITS = BigInteger.valueOf(100);

    private SubunitComputer() {}

    public static BigDecimal compute(ParsedAmount amount, CurrencyContext currency, boolean infinitePrecision) {
        int exp = amount.multiplierExponent();
        BigInteger subunitToUnit = BigInteger.valueOf(currency.subunitToUnit());

        BigInteger base = digits(amount.majorDigits()).multiply(subunitToUnit);
        base = base.multiply(BigInteger.TEN.pow(exp));

        String minor = amount.minorDigits() + "0".repeat(exp);
        base = base.add(digits(minor.substring(0, exp)).multiply(SHIFT_SUBUNITS));
        String rest = minor.substring(exp);

        BigDecimal total = infinitePrecision
                ? new BigDecimal(base).add(exactFraction(rest, subunitToUnit))
                : new BigDecimal(base.add(roundedFraction(rest, currency.decimalPlaces())));

        return amount.negative() ? total.negate() : total;
    }

    /** {@code 0.<rest> * subunitToUnit} without rounding; "5" for USD is 50, "005" is 0.5. */
    static BigDecimal exactFraction(String rest, BigInteger subunitToUnit) {
        if (rest.isEmpty()) return BigDecimal.ZERO;
        return new BigDecimal(new BigInteger(rest), rest.length())
                .multiply(new BigDecimal(subunitToUnit))
                .stripTrailingZeros();
    }

    /** Fraction digits fitted to {@code places}: padded, truncated, or rounded up on the next digit only. */
    static BigInteger roundedFraction(String rest, int places) {
        if (rest.length() < places) {
            return digits(rest + "0".repeat(places - rest.length()));
        }
        if (rest.length() > places) {
            BigInteger kept = digits(rest.substring(0, places));
            return rest.charAt(places) >= '5' ? kept.add(BigInteger.ONE) : kept;
        }
        return digits(rest);
    }

    private static BigInteger digits(String s) {
        return s.isEmpty() ? BigInteger.ZERO : new BigInteger(s);
    }
}
