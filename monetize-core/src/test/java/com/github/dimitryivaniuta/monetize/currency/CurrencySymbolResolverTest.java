package com.github.dimitryivaniuta.monetize.currency;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CurrencySymbolResolverTest {

    private final CurrencySymbolResolver resolver = new CurrencySymbolResolver();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "$10         | USD",
            "-$10        | USD",
            "+€10        | EUR",
            "£1          | GBP",
            "₤1          | GBP",
            "R$ 10       | BRL",
            "R 10        | ZAR",
            "¥500        | JPY",
            "C$1         | CAD",
            "10 CHF      | CHF",
            "10 EURO     | EUR",
            "$ 10 EUR    | USD",
    })
    void resolvesSymbolThenIsoCode(String text, String code) {
        assertThat(resolver.resolve(text)).contains(code);
    }

    @ParameterizedTest
    @ValueSource(strings = {"10", "10 $", "1.5M", "usd 10", ""})
    void nothingToResolve(String text) {
        assertThat(resolver.resolve(text)).isEmpty();
    }

    @Test
    void symbolMustLeadTheText() {
        assertThat(resolver.resolveSymbol("10 R$")).isEmpty();
        assertThat(resolver.resolveSymbol("--$10")).isEmpty();
    }

    @Test
    void longestSymbolTriedFirstWhateverTheDeclarationOrder() {
        Map<String, String> shortFirst = new LinkedHashMap<>();
        shortFirst.put("R", "ZAR");
        shortFirst.put("R$", "BRL");
        CurrencySymbolResolver r = new CurrencySymbolResolver(SymbolTable.of(shortFirst));

        assertThat(r.resolve("R$10")).contains("BRL");
        assertThat(r.resolve("R10")).contains("ZAR");
    }

    @Test
    void defaultTableIsLengthOrdered() {
        assertThat(SymbolTable.defaults().entries())
                .extracting(SymbolTable.Entry::symbol)
                .containsExactly("R$", "C$", "$", "€", "£", "₤", "R", "¥");
    }

    @Test
    void isoScanReturnsCodeVerbatim() {
        assertThat(CurrencySymbolResolver.scanIsoCode("12.50 QQ")).contains("QQ");
        assertThat(CurrencySymbolResolver.scanIsoCode("ABCD")).contains("ABC");
        assertThat(CurrencySymbolResolver.scanIsoCode(null)).isEmpty();
    }
}
