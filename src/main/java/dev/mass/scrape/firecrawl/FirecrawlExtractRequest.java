package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Request body for the Firecrawl {@code /v1/extract} endpoint. An empty {@code urls} list lets the
 * extraction agent pick pages from the prompt alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FirecrawlExtractRequest(
    List<String> urls,
    String prompt,
    Map<String, Object> schema,
    @Nullable Map<String, Object> agent) {
  public FirecrawlExtractRequest {
    urls = urls == null ? List.of() : List.copyOf(urls);
  }
}
