package com.github.dimitryivaniuta.monetize.parse;

import com.github.dimitryivaniuta.monetize.currency.CurrencyContext;
import com.github.dimitryivaniuta.monetize.currency.CurrencyRegistry;
import com.github.dimitryivaniuta.monetize.currency.CurrencySymbolResolver;
import com.github.dimitryivaniuta.monetize.money.ParsedMoney;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses human-written amounts into subunits:
 * <pre>
 * parser.parse("$1,234.56")            // 123456 USD
 * parser.parse("1.234,56", "EUR")      // 123456 EUR
 * parser.parse("1.5M")                 // 150000000 in the default currency
 * </pre>
 * Stateless apart from its collaborators; safe to share between threads.
 */
@Slf4j
public class MoneyParser {

    private final CurrencyRegistry registry;
    private final CurrencySymbolResolver symbols;
    private final ParseOptions defaults;

    public MoneyParser(CurrencyRegistry registry) {
        this(registry, new CurrencySymbolResolver(), ParseOptions.DEFAULTS);
    }

    public MoneyParser(CurrencyRegistry registry, ParseOptions defaults) {
        this(registry, new CurrencySymbolResolver(), defaults);
    }

    public MoneyParser(CurrencyRegistry registry, CurrencySymbolResolver symbols, ParseOptions defaults) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public ParseOptions defaults() { return defaults; }

    public ParsedMoney parse(String input) {
        return parse(input, null, defaults);
    }

    public ParsedMoney parse(String input, String defaultCurrency) {
        return parse(input, defaultCurrency, defaults);
    }

    /**
     * @param input           raw text; {@code null} reads as empty (zero)
     * @param defaultCurrency used when the text names no currency; {@code null} means the registry default
     * @param options         switches for this call
     * @throws InvalidAmountException                                             if the text is not an amount
     * @throws com.github.dimitryivaniuta.monetize.currency.UnknownCurrencyException if the resolved code is not registered
     */
    public ParsedMoney parse(String input, String defaultCurrency, ParseOptions options) {
        String text = input == null ? "" : input.strip();

        String code = computeCurrency(text, options.assumeFromSymbol())
                .orElse(defaultCurrency != null ? defaultCurrency : registry.defaultIdentifier());
        CurrencyContext currency = registry.lookup(code);

        BigDecimal subunits = extractSubunits(text, currency, options.infinitePrecision());
        log.debug("parse('{}') -> {} {}", text, subunits, currency.code());
        return new ParsedMoney(subunits, currency.code());
    }

    /** Subunits of {@code text} in an already-known currency. */
    public BigDecimal extractSubunits(String text, CurrencyContext currency, boolean infinitePrecision) {
        int exponent = MultiplierExtractor.extract(text);
        Cleaned cleaned = clean(text);
        DelimiterDisambiguator.Split split = DelimiterDisambiguator.disambiguate(cleaned.digits(), currency.decimalMark());
        ParsedAmount amount = new ParsedAmount(split.major(), split.minor(), cleaned.negative(), exponent);
        return SubunitComputer.compute(amount, currency, infinitePrecision);
    }

    private Optional<String> computeCurrency(String text, boolean assumeFromSymbol) {
        return assumeFromSymbol ? symbols.resolve(text) : CurrencySymbolResolver.scanIsoCode(text);
    }

    /* ======================================================================
       Cleaning
       ====================================================================== */

    /** Digits and separators left once the sign is taken off. */
    public record Cleaned(String digits, boolean negative) {}

    /**
     * Keeps digits, {@code . , ' -}; takes the sign from a leading or trailing hyphen;
     * drops one trailing {@code .} or {@code ,}.
     *
     * @throws InvalidAmountException if a hyphen remains inside the number ("12-34")
     */
    public static Cleaned clean(String text) {
        String num = text.replaceAll("[^\\d.,'-]", "");

        boolean negative = num.startsWith("-") || num.endsWith("-");
        if (negative) num = num.replaceFirst("^-|-$", "");

        if (num.indexOf('-') >= 0) throw new InvalidAmountException("Invalid currency amount (hyphen)", text);

        if (num.endsWith(".") || num.endsWith(",")) num = num.substring(0, num.length() - 1);
        return new Cleaned(num, negative);
    }
}
