package dev.mass.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.mass.enrich.ChatModelEnricher;
import dev.mass.enrich.ContentEnricher;
import dev.mass.enrich.EnrichmentProperties;
import dev.mass.enrich.EnrichmentService;
import dev.mass.enrich.KeywordHeuristicEnricher;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the enrichment strategy once, at startup.
 *
 * <p>With {@code mass.enrichment.openai.api-key} set, items go through an OpenAI chat model via
 * LangChain4j. Without a key, or if the model cannot be built, the keyword heuristics are used.
 */
@Configuration
public class EnrichmentConfig {

  private static final Logger log = LoggerFactory.getLogger(EnrichmentConfig.class);

  @Bean
  public KeywordHeuristicEnricher keywordHeuristicEnricher() {
    return new KeywordHeuristicEnricher();
  }

  @Bean
  public EnrichmentService enrichmentService(
      EnrichmentProperties properties,
      KeywordHeuristicEnricher fallback,
      ObjectMapper objectMapper,
      @Qualifier("adapterExecutor") ExecutorService executor) {
    return new EnrichmentService(primary(properties, fallback, objectMapper, executor), fallback);
  }

  private static ContentEnricher primary(
      EnrichmentProperties properties,
      KeywordHeuristicEnricher fallback,
      ObjectMapper objectMapper,
      ExecutorService executor) {
    EnrichmentProperties.OpenAi openai = properties.openai();
    if (openai == null || !openai.hasApiKey()) {
      log.warn("Remote enrichment model not configured, using keyword heuristics");
      return fallback;
    }
    try {
      OpenAiChatModel model =
          OpenAiChatModel.builder()
              .apiKey(openai.apiKey())
              .modelName(openai.modelName())
              .temperature(openai.temperature())
              .maxTokens(openai.maxTokens())
              .build();
      log.info("Initialized remote enrichment model {}", openai.modelName());
      return new ChatModelEnricher(model, objectMapper, executor, properties.batchSize());
    } catch (RuntimeException e) {
      log.error("Failed to initialize remote enrichment model, using keyword heuristics: {}", e.getMessage());
      return fallback;
    }
  }
}
