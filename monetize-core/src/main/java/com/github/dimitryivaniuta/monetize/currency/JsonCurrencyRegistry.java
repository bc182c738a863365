package com.github.dimitryivaniuta.monetize.currency;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Currency registry backed by a JSON table on the classpath (money gem layout:
 * {@code {"usd": {"iso_code": "USD", "subunit_to_unit": 100, "decimal_mark": ".", ...}}}).
 * Overrides passed to the constructor are merged field by field into the table entry
 * of the same code, or added as new entries.
 */
@Slf4j
public class JsonCurrencyRegistry implements CurrencyRegistry {

    public static final String DEFAULT_TABLE = "monetize/currency_iso.json";

    private final Map<String, CurrencyContext> byCode;
    private final String defaultIdentifier;

    public JsonCurrencyRegistry(String defaultIdentifier) {
        this(defaultIdentifier, Map.of());
    }

    public JsonCurrencyRegistry(String defaultIdentifier, Map<String, CurrencyOverride> overrides) {
        this(new ObjectMapper(), DEFAULT_TABLE, defaultIdentifier, overrides);
    }

    public JsonCurrencyRegistry(ObjectMapper mapper,
                                String resource,
                                String defaultIdentifier,
                                Map<String, CurrencyOverride> overrides) {
        Map<String, CurrencyContext> table = load(mapper, resource);
        overrides.forEach((code, override) -> {
            String key = normalize(code);
            CurrencyContext base = table.get(key);
            if (base != null) log.warn("Currency {} from {} overridden by configuration", key, resource);
            table.put(key, override.applyTo(key, base));
        });
        this.byCode = Collections.unmodifiableMap(table);

        if (defaultIdentifier == null || defaultIdentifier.isBlank())
            throw new IllegalArgumentException("defaultIdentifier must not be blank");
        this.defaultIdentifier = normalize(defaultIdentifier);
        if (!byCode.containsKey(this.defaultIdentifier)) throw new UnknownCurrencyException(this.defaultIdentifier);

        log.info("Currency registry ready: {} currencies, default={}", byCode.size(), this.defaultIdentifier);
    }

    @Override
    public CurrencyContext lookup(String identifier) {
        if (identifier == null) throw new UnknownCurrencyException(null);
        CurrencyContext ctx = byCode.get(normalize(identifier));
        if (ctx == null) throw new UnknownCurrencyException(identifier);
        return ctx;
    }

    @Override
    public String defaultIdentifier() { return defaultIdentifier; }

    public Set<String> codes() { return byCode.keySet(); }

    /* ======================================================================
       Table loading
       ====================================================================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CurrencyEntry(
            @JsonProperty("iso_code") String isoCode,
            @JsonProperty("subunit_to_unit") int subunitToUnit,
            @JsonProperty("decimal_mark") String decimalMark,
            @JsonProperty("thousands_separator") String thousandsSeparator
    ) {
        CurrencyContext toContext(String key) {
            return CurrencyContext.of(
                    normalize(isoCode != null ? isoCode : key),
                    firstChar(decimalMark, '.'),
                    firstChar(thousandsSeparator, ','),
                    subunitToUnit);
        }
    }

    private static Map<String, CurrencyContext> load(ObjectMapper mapper, String resource) {
        ClassLoader cl = JsonCurrencyRegistry.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Currency table not found on classpath: " + resource);
            Map<String, CurrencyEntry> raw = mapper.readValue(in, new TypeReference<LinkedHashMap<String, CurrencyEntry>>() {});
            Map<String, CurrencyContext> out = new LinkedHashMap<>();
            for (Map.Entry<String, CurrencyEntry> e : raw.entrySet()) {
                if (e.getValue() == null)
                    throw new IllegalStateException("Empty currency entry '" + e.getKey() + "' in " + resource);
                CurrencyContext ctx;
                try {
                    ctx = e.getValue().toContext(e.getKey());
                } catch (IllegalArgumentException ex) {
                    throw new IllegalStateException("Invalid currency entry '" + e.getKey() + "' in " + resource, ex);
                }
                out.put(ctx.code(), ctx);
            }
            log.debug("Loaded {} currencies from {}", out.size(), resource);
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read currency table " + resource, e);
        }
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static char firstChar(String s, char fallback) {
        return (s == null || s.isEmpty()) ? fallback : s.charAt(0);
    }
}
