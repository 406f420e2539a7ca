package dev.mass.pipeline;

import dev.mass.enrich.EnrichmentService;
import dev.mass.scrape.ResultItem;
import dev.mass.scrape.ScrapeCoordinator;
import dev.mass.scrape.ScrapeProperties;
import dev.mass.scrape.ScrapeRun;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one scrape end to end: coordinated fan-out, merge, then enrichment. Shared by the REST and
 * MCP surfaces.
 */
@Service
public class ScrapeService {

  private static final Logger log = LoggerFactory.getLogger(ScrapeService.class);

  private final ScrapeCoordinator coordinator;
  private final EnrichmentService enrichmentService;
  private final ScrapeProperties properties;

  public ScrapeService(
      ScrapeCoordinator coordinator,
      EnrichmentService enrichmentService,
      ScrapeProperties properties) {
    this.coordinator = coordinator;
    this.enrichmentService = enrichmentService;
    this.properties = properties;
  }

  /**
   * @param keywords search keywords, must not be blank
   * @param targetDomain optional domain restriction
   * @param maxPages pages per source, or {@code null} for the configured default
   * @return enriched results with run metadata
   * @throws IllegalArgumentException if keywords are blank or maxPages is below 1
   */
  public ScrapeResponse scrape(
      String keywords, @Nullable String targetDomain, @Nullable Integer maxPages) {
    int pages = maxPages != null ? maxPages : properties.getDefaultMaxPages();
    log.info("Received scraping request for keywords: {}", keywords);

    ScrapeRun run = coordinator.run(keywords, targetDomain, pages);
    List<ResultItem> enhanced = enrichmentService.enhance(run.results(), keywords);
    return new ScrapeResponse(enhanced, run.metadata().withTotalResults(enhanced.size()));
  }
}
