package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Poll response of {@code GET /v1/extract/{id}}. {@code data} is kept as a raw tree because its
 * shape depends on the requested schema and is not guaranteed by the service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirecrawlExtractStatus(
    boolean success, @Nullable String status, @Nullable JsonNode data, @Nullable String error) {

  public boolean isCompleted() {
    return "completed".equalsIgnoreCase(status);
  }

  public boolean isFailed() {
    return "failed".equalsIgnoreCase(status) || "cancelled".equalsIgnoreCase(status);
  }
}
