package com.ledgerbook.finance.config;

import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerbook.reports")
public record ReportsProperties(
        String defaultCurrency,
        String locale,
        String uncategorizedLabel
) {
    public ReportsProperties {
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "USD";
        }
        if (locale == null || locale.isBlank()) {
            locale = "en-US";
        }
        if (uncategorizedLabel == null || uncategorizedLabel.isBlank()) {
            uncategorizedLabel = "Uncategorized";
        }
    }

    public Locale resolvedLocale() {
        return Locale.forLanguageTag(locale);
    }
}
