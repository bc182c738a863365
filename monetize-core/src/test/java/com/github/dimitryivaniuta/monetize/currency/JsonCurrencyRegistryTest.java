package com.github.dimitryivaniuta.monetize.currency;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCurrencyRegistryTest {

    private final JsonCurrencyRegistry registry = new JsonCurrencyRegistry("USD");

    @ParameterizedTest(name = "{0}: mark {1}, ratio {2}, places {3}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "USD | . | 100  | 2",
            "EUR | , | 100  | 2",
            "BRL | , | 100  | 2",
            "ZAR | . | 100  | 2",
            "JPY | . | 1    | 0",
            "KWD | . | 1000 | 3",
            "MGA | . | 5    | 1",
    })
    void bundledTableCarriesConventions(String code, char mark, int ratio, int places) {
        CurrencyContext ctx = registry.lookup(code);
        assertThat(ctx.code()).isEqualTo(code);
        assertThat(ctx.decimalMark()).isEqualTo(mark);
        assertThat(ctx.subunitToUnit()).isEqualTo(ratio);
        assertThat(ctx.decimalPlaces()).isEqualTo(places);
    }

    @Test
    void lookupIgnoresCase() {
        assertThat(registry.lookup("eur")).isEqualTo(registry.lookup("EUR"));
        assertThat(registry.lookup(" gbp ").code()).isEqualTo("GBP");
    }

    @Test
    void everySymbolTableCodeIsRegistered() {
        SymbolTable.defaults().entries()
                .forEach(e -> assertThat(registry.codes()).contains(e.code()));
    }

    @Test
    void unknownCodeCarriesCode() {
        assertThatThrownBy(() -> registry.lookup("XYZ"))
                .isInstanceOfSatisfying(UnknownCurrencyException.class, e -> assertThat(e.getCode()).isEqualTo("XYZ"));
        assertThatThrownBy(() -> registry.lookup(null)).isInstanceOf(UnknownCurrencyException.class);
    }

    @Test
    void defaultCurrency() {
        JsonCurrencyRegistry eur = new JsonCurrencyRegistry("eur");
        assertThat(eur.defaultIdentifier()).isEqualTo("EUR");
        assertThat(eur.defaultCurrency().decimalMark()).isEqualTo(',');
    }

    @Test
    void unregisteredDefaultFailsFast() {
        assertThatThrownBy(() -> new JsonCurrencyRegistry("XYZ")).isInstanceOf(UnknownCurrencyException.class);
        assertThatThrownBy(() -> new JsonCurrencyRegistry(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overridesAddAndReplaceEntries() {
        JsonCurrencyRegistry custom = new JsonCurrencyRegistry("USD", Map.of(
                "xbt", new CurrencyOverride(null, null, 100_000_000),
                "USD", CurrencyOverride.of(CurrencyContext.of("USD", ',', '.', 100))));

        assertThat(custom.lookup("XBT")).isEqualTo(new CurrencyContext("XBT", '.', ',', 100_000_000, 8));
        assertThat(custom.lookup("USD").decimalMark()).isEqualTo(',');
        assertThat(registry.lookup("USD").decimalMark()).isEqualTo('.');
    }

    @Test
    void partialOverrideKeepsTableValues() {
        JsonCurrencyRegistry custom = new JsonCurrencyRegistry("USD", Map.of(
                "eur", new CurrencyOverride(null, null, 1000),
                "BRL", new CurrencyOverride(null, ' ', null)));

        assertThat(custom.lookup("EUR")).isEqualTo(new CurrencyContext("EUR", ',', '.', 1000, 3));
        assertThat(custom.lookup("BRL")).isEqualTo(new CurrencyContext("BRL", ',', ' ', 100, 2));
    }

    @Test
    void readsAlternativeTable() {
        JsonCurrencyRegistry small = new JsonCurrencyRegistry(
                new ObjectMapper(), "monetize/test_currencies.json", "CHF", Map.of());

        assertThat(small.codes()).containsExactlyInAnyOrder("USD", "CHF", "XTS");
        assertThat(small.lookup("CHF").thousandsSeparator()).isEqualTo('\'');
        // missing thousands separator falls back to ','
        assertThat(small.lookup("xts")).isEqualTo(new CurrencyContext("XTS", ',', ',', 1000, 3));
    }

    @Test
    void entryWithoutIsoCodeUsesItsKey() {
        JsonCurrencyRegistry keyed = new JsonCurrencyRegistry(
                new ObjectMapper(), "monetize/test_currencies_no_iso.json", "SEK", Map.of());

        assertThat(keyed.codes()).containsExactly("USD", "SEK");
        assertThat(keyed.defaultCurrency()).isEqualTo(new CurrencyContext("SEK", ',', ' ', 100, 2));
    }

    @Test
    void invalidEntryIsATableError() {
        assertThatThrownBy(() -> new JsonCurrencyRegistry(
                        new ObjectMapper(), "monetize/test_currencies_bad_ratio.json", "USD", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("usd")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingTableIsAnError() {
        assertThatThrownBy(() -> new JsonCurrencyRegistry(new ObjectMapper(), "monetize/nope.json", "USD", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("monetize/nope.json");
    }
}
