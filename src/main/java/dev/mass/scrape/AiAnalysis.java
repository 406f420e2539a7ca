package dev.mass.scrape;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Analysis attached to an item under {@code metadata.ai_analysis}. Both enrichment strategies
 * produce this same shape.
 *
 * @param relevanceScore relevance to the query, 0 to 100
 * @param contentType kind of content, e.g. {@code video} or {@code article}
 * @param tags at most {@value #MAX_TAGS} tags
 */
public record AiAnalysis(
    @JsonProperty("relevance_score") int relevanceScore,
    @JsonProperty("content_type") String contentType,
    List<String> tags) {

  public static final int MAX_TAGS = 5;

  public AiAnalysis {
    relevanceScore = Math.max(0, Math.min(100, relevanceScore));
    contentType = contentType == null || contentType.isBlank() ? "unknown" : contentType;
    tags = tags == null ? List.of() : List.copyOf(tags.subList(0, Math.min(MAX_TAGS, tags.size())));
  }
}
