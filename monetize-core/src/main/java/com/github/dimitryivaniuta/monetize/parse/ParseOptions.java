package com.github.dimitryivaniuta.monetize.parse;

/**
 * Per-call parser switches.
 *
 * @param assumeFromSymbol  infer the currency from a leading symbol ("R$", "£") before scanning for an ISO code
 * @param infinitePrecision keep fractional subunits exactly instead of rounding to the currency's decimal places
 */
public record ParseOptions(boolean assumeFromSymbol, boolean infinitePrecision) {

    /** Both switches off. */
    public static final ParseOptions DEFAULTS = new ParseOptions(false, false);

    public ParseOptions withAssumeFromSymbol(boolean value) { return new ParseOptions(value, infinitePrecision); }

    public ParseOptions withInfinitePrecision(boolean value) { return new ParseOptions(assumeFromSymbol, value); }
}
