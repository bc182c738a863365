package com.github.dimitryivaniuta.monetize.currency;

/**
 * Per-currency metadata the parser needs.
 *
 * @param code               ISO code (upper-case)
 * @param decimalMark        character separating whole units from the fraction ("." for USD, "," for EUR)
 * @param thousandsSeparator grouping character, informational only
 * @param subunitToUnit      subunits in one major unit (100 for USD, 1 for JPY)
 * @param decimalPlaces      fraction digits kept when rounding (2 for USD, 0 for JPY)
 */
public record CurrencyContext(
        String code,
        char decimalMark,
        char thousandsSeparator,
        int subunitToUnit,
        int decimalPlaces
) {
    public CurrencyContext {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("code must not be blank");
        if (subunitToUnit < 1) throw new IllegalArgumentException("subunitToUnit must be >= 1 for " + code);
        if (decimalPlaces < 0) throw new IllegalArgumentException("decimalPlaces must be >= 0 for " + code);
    }

    /** Builds a context deriving the decimal places from the subunit ratio (100 -> 2, 1 -> 0, 5 -> 1). */
    public static CurrencyContext of(String code, char decimalMark, char thousandsSeparator, int subunitToUnit) {
        return new CurrencyContext(code, decimalMark, thousandsSeparator, subunitToUnit, decimalPlacesFor(subunitToUnit));
    }

    static int decimalPlacesFor(int subunitToUnit) {
        if (subunitToUnit < 1) throw new IllegalArgumentException("subunitToUnit must be >= 1");
        return (int) Math.round(Math.log10(subunitToUnit));
    }
}
