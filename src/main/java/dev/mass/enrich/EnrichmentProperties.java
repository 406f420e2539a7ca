package dev.mass.enrich;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mass.enrichment")
public record EnrichmentProperties(int batchSize, OpenAi openai) {

  public EnrichmentProperties {
    if (batchSize < 1) {
      batchSize = 5;
    }
  }

  public record OpenAi(String apiKey, String modelName, double temperature, int maxTokens) {

    public boolean hasApiKey() {
      return apiKey != null && !apiKey.isBlank();
    }
  }
}
