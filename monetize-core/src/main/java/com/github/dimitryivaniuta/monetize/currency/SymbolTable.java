package com.github.dimitryivaniuta.monetize.currency;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal currency symbols mapped to ISO codes, kept longest-symbol-first so a symbol
 * that is a prefix of another ("R" of "R$") can never shadow it.
 */
public final class SymbolTable {

    public record Entry(String symbol, String code) {}

    private static final SymbolTable DEFAULTS = of(defaultSymbols());

    private final List<Entry> entries;

    private SymbolTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /** Builds a table from declaration-ordered symbols; ties in length keep declaration order. */
    public static SymbolTable of(Map<String, String> symbolToCode) {
        List<Entry> list = new ArrayList<>();
        symbolToCode.forEach((symbol, code) -> {
            if (symbol == null || symbol.isEmpty()) throw new IllegalArgumentException("symbol must not be empty");
            list.add(new Entry(symbol, code));
        });
        list.sort(Comparator.comparingInt((Entry e) -> e.symbol().length()).reversed());
        return new SymbolTable(list);
    }

    public static SymbolTable defaults() { return DEFAULTS; }

    /** Entries in match order (longest symbol first). */
    public List<Entry> entries() { return entries; }

    private static Map<String, String> defaultSymbols() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("$", "USD");
        m.put("€", "EUR");
        m.put("£", "GBP");
        m.put("₤", "GBP");
        m.put("R$", "BRL");
        m.put("R", "ZAR");
        m.put("¥", "JPY");
        m.put("C$", "CAD");
        return m;
    }
}
