package com.github.dimitryivaniuta.monetize.parse;

/**
 * Digits of an amount after separator disambiguation.
 *
 * @param majorDigits        whole-unit digits, may be empty (reads as zero)
 * @param minorDigits        fractional digits as written, may be empty
 * @param negative           sign taken from a leading or trailing hyphen
 * @param multiplierExponent power of ten from a K/M/B/T suffix
 */
public record ParsedAmount(String majorDigits, String minorDigits, boolean negative, int multiplierExponent) {
    public ParsedAmount {
        if (multiplierExponent < 0) throw new IllegalArgumentException("multiplierExponent must be >= 0");
    }
}
