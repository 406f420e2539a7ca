package dev.mass.enrich;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mass.scrape.AiAnalysis;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Parses the model's reply into an {@link AiAnalysis}. The JSON object may be bare or wrapped in a
 * {@code ```json} or plain {@code ```} fence.
 */
final class AnalysisReplyParser {

  private static final String JSON_FENCE = "```json";
  private static final String FENCE = "```";

  private final ObjectMapper objectMapper;

  AnalysisReplyParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Analysis plus the model's suggested description, if any. */
  record Reply(AiAnalysis analysis, @Nullable String enhancedDescription) {}

  /**
   * @throws JsonProcessingException if the (unfenced) reply is not valid JSON
   * @throws IllegalArgumentException if the reply is not a JSON object
   */
  Reply parse(String reply) throws JsonProcessingException {
    JsonNode root = objectMapper.readTree(unfence(reply.strip()));
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Analysis reply is not a JSON object");
    }
    AiAnalysis analysis =
        new AiAnalysis(
            score(root.path("relevance_score")),
            root.path("content_type").asText("unknown"),
            tags(root.path("tags")));
    String description = root.path("enhanced_description").asText("");
    return new Reply(analysis, description.isBlank() ? null : description);
  }

  static String unfence(String text) {
    return between(text, JSON_FENCE).or(() -> between(text, FENCE)).orElse(text);
  }

  private static Optional<String> between(String text, String opening) {
    int start = text.indexOf(opening);
    if (start < 0) {
      return Optional.empty();
    }
    int bodyStart = start + opening.length();
    int end = text.indexOf(FENCE, bodyStart);
    return end < 0 ? Optional.empty() : Optional.of(text.substring(bodyStart, end).strip());
  }

  private static int score(JsonNode node) {
    if (node.isNumber()) {
      return (int) Math.round(node.asDouble());
    }
    if (node.isTextual()) {
      try {
        return (int) Math.round(Double.parseDouble(node.asText().trim()));
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }

  private static List<String> tags(JsonNode node) {
    List<String> tags = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode tag : node) {
        if (tag.isValueNode() && !tag.asText().isBlank()) {
          tags.add(tag.asText().strip());
        }
      }
    }
    return tags;
  }
}
