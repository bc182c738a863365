package com.github.dimitryivaniuta.monetize.currency;

/** Source of currency metadata, e.g. "USD" -> '.', 100, 2. */
public interface CurrencyRegistry {

    /**
     * Metadata for a currency identifier, case-insensitive.
     *
     * @throws UnknownCurrencyException if the identifier is not registered
     */
    CurrencyContext lookup(String identifier);

    /** Identifier used when neither the input nor the caller names a currency. */
    String defaultIdentifier();

    /** Convenience for {@code lookup(defaultIdentifier())}. */
    default CurrencyContext defaultCurrency() { return lookup(defaultIdentifier()); }
}
