package com.ledgerbook.finance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ledgerbook.finance.money.LocaleMoneyFormatter;
import com.ledgerbook.finance.money.MoneyFormatter;
import com.ledgerbook.finance.services.reports.StatementAggregator;
import com.ledgerbook.finance.services.reports.StatementFormatter;

@Configuration
public class ReportsConfig {

    @Bean
    public MoneyFormatter moneyFormatter(ReportsProperties properties) {
        return new LocaleMoneyFormatter(properties.resolvedLocale());
    }

    @Bean
    public StatementAggregator statementAggregator(ReportsProperties properties) {
        return new StatementAggregator(properties.defaultCurrency());
    }

    @Bean
    public StatementFormatter statementFormatter(MoneyFormatter moneyFormatter, ReportsProperties properties) {
        return new StatementFormatter(moneyFormatter, properties.resolvedLocale());
    }
}
