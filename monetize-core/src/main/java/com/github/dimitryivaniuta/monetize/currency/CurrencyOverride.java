package com.github.dimitryivaniuta.monetize.currency;

/**
 * Partial currency entry layered over the bundled table. A {@code null} field keeps the
 * bundled value; for a code the table does not know it falls back to '.', ',' and 100.
 */
public record CurrencyOverride(Character decimalMark, Character thousandsSeparator, Integer subunitToUnit) {

    private static final char DEFAULT_DECIMAL_MARK = '.';
    private static final char DEFAULT_THOUSANDS_SEPARATOR = ',';
    private static final int DEFAULT_SUBUNIT_TO_UNIT = 100;

    /** Full replacement carrying every field of {@code ctx}. */
    public static CurrencyOverride of(CurrencyContext ctx) {
        return new CurrencyOverride(ctx.decimalMark(), ctx.thousandsSeparator(), ctx.subunitToUnit());
    }

    /** @param base bundled entry for {@code code}, or {@code null} when the code is new */
    public CurrencyContext applyTo(String code, CurrencyContext base) {
        if (base == null) {
            return CurrencyContext.of(code,
                    decimalMark != null ? decimalMark : DEFAULT_DECIMAL_MARK,
                    thousandsSeparator != null ? thousandsSeparator : DEFAULT_THOUSANDS_SEPARATOR,
                    subunitToUnit != null ? subunitToUnit : DEFAULT_SUBUNIT_TO_UNIT);
        }
        return CurrencyContext.of(code,
                decimalMark != null ? decimalMark : base.decimalMark(),
                thousandsSeparator != null ? thousandsSeparator : base.thousandsSeparator(),
                subunitToUnit != null ? subunitToUnit : base.subunitToUnit());
    }
}
