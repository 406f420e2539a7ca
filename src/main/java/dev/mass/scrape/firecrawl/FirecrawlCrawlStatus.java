package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Poll response of {@code GET /v1/crawl/{id}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirecrawlCrawlStatus(
    @Nullable String status, List<FirecrawlDocument> data, @Nullable String error) {
  public FirecrawlCrawlStatus {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public boolean isCompleted() {
    return "completed".equalsIgnoreCase(status);
  }

  public boolean isFailed() {
    return "failed".equalsIgnoreCase(status) || "cancelled".equalsIgnoreCase(status);
  }
}
