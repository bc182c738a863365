package com.github.dimitryivaniuta.monetize.money;

import com.github.dimitryivaniuta.monetize.currency.CurrencyContext;
import com.github.dimitryivaniuta.monetize.currency.CurrencyRegistry;
import com.github.dimitryivaniuta.monetize.parse.InvalidAmountException;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Converts values that are already numeric (major units) into subunits:
 * {@code fromDecimal(new BigDecimal("12.345"), "USD")} is 1235 USD.
 * A {@code null} currency means the registry default.
 */
@RequiredArgsConstructor
public class NumericAmounts {

    private final CurrencyRegistry registry;
    private final boolean infinitePrecision;

    public NumericAmounts(CurrencyRegistry registry) {
        this(registry, false);
    }

    public ParsedMoney fromInteger(long value, String currency) {
        return fromInteger(BigInteger.valueOf(value), currency);
    }

    public ParsedMoney fromInteger(BigInteger value, String currency) {
        if (value == null) throw new UnsupportedValueTypeException(null);
        CurrencyContext ctx = currency(currency);
        return ParsedMoney.of(value.multiply(BigInteger.valueOf(ctx.subunitToUnit())), ctx.code());
    }

    /** Scales by the subunit ratio; rounds half-up to whole subunits unless infinite precision is on. */
    public ParsedMoney fromDecimal(BigDecimal value, String currency) {
        if (value == null) throw new UnsupportedValueTypeException(null);
        CurrencyContext ctx = currency(currency);
        BigDecimal subunits = value.multiply(BigDecimal.valueOf(ctx.subunitToUnit()));
        if (!infinitePrecision) subunits = subunits.setScale(0, RoundingMode.HALF_UP);
        return new ParsedMoney(subunits, ctx.code());
    }

    /** Plain decimal notation only ("12.50", "-3", "1E+3"); no symbols or grouping. */
    public ParsedMoney fromString(String value, String currency) {
        if (value == null) throw new UnsupportedValueTypeException(null);
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Not a decimal number", value, e);
        }
        return fromDecimal(decimal, currency);
    }

    public ParsedMoney fromNumeric(Object value, String currency) {
        if (value instanceof BigInteger i) return fromInteger(i, currency);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof AtomicLong || value instanceof AtomicInteger) {
            return fromInteger(((Number) value).longValue(), currency);
        }
        if (value instanceof BigDecimal d) return fromDecimal(d, currency);
        if (value instanceof Double d && !Double.isFinite(d)) throw new UnsupportedValueTypeException(value);
        if (value instanceof Float f && !Float.isFinite(f)) throw new UnsupportedValueTypeException(value);
        if (value instanceof Number n) {
            // toString keeps the shortest decimal form, so 0.1d stays 0.1 rather than its binary expansion
            try {
                return fromDecimal(new BigDecimal(n.toString()), currency);
            } catch (NumberFormatException e) {
                throw new UnsupportedValueTypeException(value, e);
            }
        }
        throw new UnsupportedValueTypeException(value);
    }

    private CurrencyContext currency(String currency) {
        return currency == null ? registry.defaultCurrency() : registry.lookup(currency);
    }
}
