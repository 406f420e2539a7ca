package dev.mass.enrich;

import dev.mass.scrape.AiAnalysis;
import dev.mass.scrape.ResultItem;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the enrichment stage. Delegates to the strategy chosen at startup and falls back
 * to the keyword heuristics if that strategy fails as a whole.
 */
public class EnrichmentService {

  private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

  private final ContentEnricher primary;
  private final KeywordHeuristicEnricher fallback;

  public EnrichmentService(ContentEnricher primary, KeywordHeuristicEnricher fallback) {
    this.primary = primary;
    this.fallback = fallback;
  }

  /**
   * Annotates each item with an {@link AiAnalysis}.
   *
   * @param items merged results
   * @param keywords the query the results were found for
   * @return items in the same order, same length as {@code items}
   */
  public List<ResultItem> enhance(List<ResultItem> items, String keywords) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    log.info("Processing {} results with {}", items.size(), strategyName());
    try {
      List<ResultItem> enhanced = primary.enhance(items, keywords);
      if (enhanced.size() == items.size()) {
        return enhanced;
      }
      log.warn("{} returned {} of {} items", strategyName(), enhanced.size(), items.size());
    } catch (RuntimeException e) {
      log.warn("{} failed, using keyword heuristics: {}", strategyName(), e.getMessage());
    }
    return fallback.enhance(items, keywords);
  }

  /** Simple name of the active strategy. */
  public String strategyName() {
    return primary.getClass().getSimpleName();
  }
}
