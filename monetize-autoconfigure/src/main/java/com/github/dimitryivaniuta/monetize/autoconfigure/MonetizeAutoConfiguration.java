package com.github.dimitryivaniuta.monetize.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.monetize.currency.CurrencyRegistry;
import com.github.dimitryivaniuta.monetize.currency.CurrencySymbolResolver;
import com.github.dimitryivaniuta.monetize.currency.JsonCurrencyRegistry;
import com.github.dimitryivaniuta.monetize.money.NumericAmounts;
import com.github.dimitryivaniuta.monetize.parse.MoneyParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes the parser stack as beans configured from monetize.*.
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({
        MonetizeProperties.class
})
public class MonetizeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CurrencyRegistry currencyRegistry(MonetizeProperties p) {
        // own mapper: the table is read once and must not depend on the application's Jackson settings
        return new JsonCurrencyRegistry(new ObjectMapper(), p.getTable(), p.getDefaultCurrency(), p.currencyOverrides());
    }

    @Bean
    @ConditionalOnMissingBean
    public CurrencySymbolResolver currencySymbolResolver() {
        return new CurrencySymbolResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public MoneyParser moneyParser(CurrencyRegistry registry, CurrencySymbolResolver symbols, MonetizeProperties p) {
        log.info("MoneyParser configured: assumeFromSymbol={} infinitePrecision={}",
                p.isAssumeFromSymbol(), p.isInfinitePrecision());
        return new MoneyParser(registry, symbols, p.parseOptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public NumericAmounts numericAmounts(CurrencyRegistry registry, MonetizeProperties p) {
        return new NumericAmounts(registry, p.isInfinitePrecision());
    }
}
