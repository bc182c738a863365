package com.github.dimitryivaniuta.monetize.parse;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads a trailing magnitude suffix: "1.5M" -> 6, "20k USD" -> 3, "12" -> 0. */
public final class MultiplierExtractor {

    private static final Map<String, Integer> EXPONENTS = Map.of(
            "K", 3,
            "M", 6,
            "B", 9,
            "T", 12);

    // digit, suffix, then nothing numeric until the end
    private static final Pattern SUFFIX = Pattern.compile("\\d(K|M|B|T)\\b[^\\d]*$", Pattern.CASE_INSENSITIVE);

    private MultiplierExtractor() {}

    public static int extract(String text) {
        if (text == null) return 0;
        Matcher m = SUFFIX.matcher(text);
        if (!m.find()) return 0;
        return EXPONENTS.getOrDefault(m.group(1).toUpperCase(Locale.ROOT), 0);
    }
}
