package dev.mass.scrape.firecrawl;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mass.firecrawl")
public record FirecrawlProperties(
    String baseUrl,
    String apiKey,
    int connectTimeoutMs,
    int readTimeoutMs,
    long pollIntervalMs,
    int maxPolls,
    long strategyDelayMs,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
