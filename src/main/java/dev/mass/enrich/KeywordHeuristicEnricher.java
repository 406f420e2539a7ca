package dev.mass.enrich;

import dev.mass.scrape.AiAnalysis;
import dev.mass.scrape.ResultItem;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic enrichment used when no remote model is available. Tags are the query tokens
 * longer than two characters; relevance is ten points per token occurrence in title and
 * description, capped at 100; content type comes from {@link ContentKind#classify}.
 */
public class KeywordHeuristicEnricher implements ContentEnricher {

  static final String PROCESSED_KEY = "processed";

  @Override
  public List<ResultItem> enhance(List<ResultItem> items, String keywords) {
    List<String> tags = tags(keywords);
    return items.stream().map(item -> analyse(item, tags)).toList();
  }

  private static ResultItem analyse(ResultItem item, List<String> tags) {
    String title = item.title().toLowerCase(Locale.ROOT);
    String description =
        item.description() == null ? "" : item.description().toLowerCase(Locale.ROOT);

    int occurrences = 0;
    for (String tag : tags) {
      occurrences += count(title, tag) + count(description, tag);
    }
    AiAnalysis analysis =
        new AiAnalysis(
            Math.min(100, occurrences * 10), ContentKind.classify(item.link()).value(), tags);
    return item.withMetadata(PROCESSED_KEY, true)
        .withMetadata(ResultItem.AI_ANALYSIS_KEY, analysis);
  }

  static List<String> tags(String keywords) {
    if (keywords == null || keywords.isBlank()) {
      return List.of();
    }
    return Arrays.stream(keywords.trim().split("\\s+"))
        .map(token -> token.toLowerCase(Locale.ROOT))
        .filter(token -> token.length() > 2)
        .limit(AiAnalysis.MAX_TAGS)
        .toList();
  }

  /** Non-overlapping occurrences of {@code needle} in {@code haystack}. */
  static int count(String haystack, String needle) {
    int count = 0;
    int from = haystack.indexOf(needle);
    while (from >= 0) {
      count++;
      from = haystack.indexOf(needle, from + needle.length());
    }
    return count;
  }
}
