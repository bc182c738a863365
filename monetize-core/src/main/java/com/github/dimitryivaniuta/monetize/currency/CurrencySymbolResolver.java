package com.github.dimitryivaniuta.monetize.currency;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the currency named by a raw amount: a leading symbol ("R$ 10", "-£12") first,
 * then the first 2-3 letter upper-case run ("10 USD").
 */
public final class CurrencySymbolResolver {

    private static final Pattern ISO_CODE = Pattern.compile("[A-Z]{2,3}");

    private final SymbolTable table;
    private final Pattern leadingSymbol;

    public CurrencySymbolResolver() {
        this(SymbolTable.defaults());
    }

    public CurrencySymbolResolver(SymbolTable table) {
        this.table = table;
        // alternation follows table order, so longer symbols are attempted first
        String alternatives = table.entries().stream()
                .map(e -> Pattern.quote(e.symbol()))
                .collect(Collectors.joining("|"));
        this.leadingSymbol = Pattern.compile("^[+-]?(" + alternatives + ")");
    }

    public Optional<String> resolve(String text) {
        if (text == null) return Optional.empty();
        Optional<String> bySymbol = resolveSymbol(text);
        return bySymbol.isPresent() ? bySymbol : scanIsoCode(text);
    }

    /** Code mapped from a symbol at the start of {@code text}, optionally after a sign. */
    public Optional<String> resolveSymbol(String text) {
        if (text == null) return Optional.empty();
        Matcher m = leadingSymbol.matcher(text);
        if (!m.find()) return Optional.empty();
        String symbol = m.group(1);
        return table.entries().stream()
                .filter(e -> e.symbol().equals(symbol))
                .map(SymbolTable.Entry::code)
                .findFirst();
    }

    /** First run of 2-3 upper-case letters, returned as-is (no check that it is a real code). */
    public static Optional<String> scanIsoCode(String text) {
        if (text == null) return Optional.empty();
        Matcher m = ISO_CODE.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }
}
