package com.github.dimitryivaniuta.monetize.parse;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a cleaned amount ("1,234.56", "1.234,56", "1'000") into whole and fractional digits,
 * deciding which separator is grouping and which is the decimal mark.
 *
 * <p>Expects input that holds only digits and the separators {@code . , '}: sign and
 * trailing separator already removed.
 */
@Slf4j
public final class DelimiterDisambiguator {

    /** Whole-unit and fractional digit strings; either may be empty. */
    public record Split(String major, String minor) {}

    private static final int GROUP_WIDTH = 3;

    private DelimiterDisambiguator() {}

    public static Split disambiguate(String num, char decimalMark) {
        List<Character> used = distinctSeparators(num);

        switch (used.size()) {
            case 0:
                return new Split(num, "0");
            case 2: {
                // positional: grouping comes first, the fraction last ("1,234.56")
                char thousands = used.get(0);
                char decimal = used.get(1);
                String[] parts = split(num.replace(String.valueOf(thousands), ""), decimal);
                return new Split(part(parts, 0, ""), part(parts, 1, ""));
            }
            case 1:
                return single(num, used.get(0), decimalMark);
            default:
                throw new InvalidAmountException("Invalid currency amount", num);
        }
    }

    private static Split single(String num, char sep, char decimalMark) {
        if (sep == decimalMark) {
            String[] parts = split(num, sep);
            return new Split(part(parts, 0, ""), part(parts, 1, ""));
        }

        if (occurrences(num, sep) > 1) {
            log.debug("'{}' repeats in {}; reading it as thousands separator", sep, num);
            return new Split(num.replace(String.valueOf(sep), ""), "0");
        }

        String[] parts = split(num, sep);
        String possibleMajor = part(parts, 0, "0");
        String possibleMinor = part(parts, 1, "00");

        // a trailing group of exactly three digits looks like grouping ("1,000"), anything else like a fraction
        if (possibleMinor.length() != GROUP_WIDTH
                || possibleMajor.length() > GROUP_WIDTH
                || sep == '.') {
            return new Split(possibleMajor, possibleMinor);
        }
        log.debug("'{}' in {} read as thousands separator", sep, num);
        return new Split(possibleMajor + possibleMinor, "0");
    }

    /** Non-digit characters in order of first appearance. */
    static List<Character> distinctSeparators(String num) {
        List<Character> used = new ArrayList<>();
        for (int i = 0; i < num.length(); i++) {
            char c = num.charAt(i);
            if (!isAsciiDigit(c) && !used.contains(c)) used.add(c);
        }
        return used;
    }

    private static String[] split(String s, char sep) {
        return s.split(Pattern.quote(String.valueOf(sep)));
    }

    // String#split drops trailing empty pieces, so "12." yields one part and "." none
    private static String part(String[] parts, int index, String absent) {
        return parts.length > index ? parts[index] : absent;
    }

    private static int occurrences(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == c) n++;
        return n;
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
