package com.github.dimitryivaniuta.monetize.autoconfigure;

import com.github.dimitryivaniuta.monetize.currency.CurrencyOverride;
import com.github.dimitryivaniuta.monetize.parse.ParseOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "monetize")
public class MonetizeProperties {

    /** Currency used when the text names none and the caller passes none. */
    @NotBlank
    private String defaultCurrency = "USD";

    /** Infer the currency from a leading symbol ("R$", "£") before scanning for an ISO code. */
    private boolean assumeFromSymbol = false;

    /** Keep fractional subunits instead of rounding to the currency's decimal places. */
    private boolean infinitePrecision = false;

    /** Table path on the classpath. */
    @NotBlank
    private String table = "monetize/currency_iso.json";

    /** Extra or overriding currencies keyed by ISO code. */
    @Valid
    private Map<String, Currency> currencies = new LinkedHashMap<>();

    public ParseOptions parseOptions() { return new ParseOptions(assumeFromSymbol, infinitePrecision); }

    public Map<String, CurrencyOverride> currencyOverrides() {
        Map<String, CurrencyOverride> out = new LinkedHashMap<>();
        currencies.forEach((code, c) -> out.put(code.toUpperCase(Locale.ROOT), c.toOverride()));
        return out;
    }

    /** Unset fields keep the table's value for a known code. */
    @Getter
    @Setter
    public static class Currency {
        @Size(min = 1, max = 1)
        private String decimalMark;

        @Size(min = 1, max = 1)
        private String thousandsSeparator;

        @Min(1)
        private Integer subunitToUnit;

        CurrencyOverride toOverride() {
            return new CurrencyOverride(firstChar(decimalMark), firstChar(thousandsSeparator), subunitToUnit);
        }

        private static Character firstChar(String s) {
            return s == null ? null : s.charAt(0);
        }
    }
}
