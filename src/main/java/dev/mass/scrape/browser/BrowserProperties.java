package dev.mass.scrape.browser;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mass.browser")
public record BrowserProperties(
    boolean headless,
    int navigationTimeoutMs,
    int selectorTimeoutMs,
    int settleDelayMs,
    String userAgent) {}
