package dev.mass.scrape.firecrawl;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt variants used to simulate pagination against the extract endpoint, which has no notion
 * of pages. Page {@code n} runs the {@code n}-th prompt.
 */
final class ExtractStrategies {

  private static final List<String> BASE_TEMPLATES =
      List.of("%s", "recent %s news and trends", "detailed analysis of %s");

  private static final List<String> EXTENDED_TEMPLATES =
      List.of("tutorials and guides about %s", "reviews and opinions about %s");

  private ExtractStrategies() {
    // utility class
  }

  /**
   * Returns the prompts to run for {@code query}, one per simulated page. The extended variants
   * are only added when more than three pages are requested; the list never exceeds {@code
   * maxPages} entries.
   */
  static List<String> promptsFor(String query, int maxPages) {
    List<String> templates = new ArrayList<>(BASE_TEMPLATES);
    if (maxPages > BASE_TEMPLATES.size()) {
      templates.addAll(EXTENDED_TEMPLATES);
    }
    return templates.stream()
        .limit(Math.max(0, maxPages))
        .map(template -> String.format(template, query))
        .toList();
  }
}
