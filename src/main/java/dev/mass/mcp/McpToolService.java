package dev.mass.mcp;

import dev.mass.pipeline.ScrapeResponse;
import dev.mass.pipeline.ScrapeService;
import dev.mass.registry.LinkRegistry;
import dev.mass.registry.RegistryStats;
import dev.mass.scrape.RunMetadata;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP tools mirroring the REST scrape operation plus link registry statistics.
 *
 * <p>Tool methods never throw: failures come back as {@code "Error ...: <message>"} strings.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_PAGES_LIMIT = 10;

  private final ScrapeService scrapeService;
  private final LinkRegistry linkRegistry;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      ScrapeService scrapeService, LinkRegistry linkRegistry, TokenBudgetTruncator truncator) {
    this.scrapeService = scrapeService;
    this.linkRegistry = linkRegistry;
    this.truncator = truncator;
  }

  @Tool(
      name = "scrape_content",
      description =
          "Search several web sources for content matching the keywords. "
              + "Returns deduplicated results with links, sources and relevance analysis.")
  public String scrapeContent(
      @ToolParam(description = "Search keywords") @Nullable String keywords,
      @ToolParam(description = "Restrict results to this domain, e.g. 'example.com'", required = false)
          @Nullable String targetDomain,
      @ToolParam(description = "Pages per source (1-10, default 3)", required = false)
          @Nullable Integer maxPages) {
    try {
      if (keywords == null || keywords.isBlank()) {
        return "Error: Keywords must not be empty.";
      }
      Integer pages = maxPages == null ? null : Math.max(1, Math.min(MAX_PAGES_LIMIT, maxPages));
      ScrapeResponse response = scrapeService.scrape(keywords, targetDomain, pages);
      if (response.results().isEmpty()) {
        return "No results found for '%s'.".formatted(keywords);
      }
      return header(response.metadata()) + truncator.truncate(response.results());
    } catch (Exception e) {
      log.warn("scrape_content failed: {}", e.getMessage());
      return "Error scraping content: " + e.getMessage();
    }
  }

  @Tool(
      name = "link_registry_stats",
      description = "Show how many links the registry holds, broken down by registrant.")
  public String linkRegistryStats() {
    try {
      RegistryStats stats = linkRegistry.stats();
      StringBuilder sb =
          new StringBuilder("Link registry: %d links\n".formatted(stats.totalLinks()));
      for (Map.Entry<String, Integer> entry : stats.countsByRegistrant().entrySet()) {
        sb.append("- %s: %d\n".formatted(entry.getKey(), entry.getValue()));
      }
      sb.append("Created: ").append(stats.createdAt()).append('\n');
      sb.append("Last updated: ").append(stats.lastUpdatedAt());
      return sb.toString();
    } catch (Exception e) {
      return "Error reading link registry: " + e.getMessage();
    }
  }

  private static String header(RunMetadata metadata) {
    return String.format(
        Locale.ROOT,
        "%d results from %s in %.2fs\n\n",
        metadata.totalResults(),
        String.join(", ", metadata.sourcesUsed()),
        metadata.executionTimeSeconds());
  }
}
