package dev.mass.scrape;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the scraping pipeline.
 *
 * <p>Properties are bound from {@code mass.scrape.*} in application.yml and read once, when the
 * coordinator and its adapters are constructed.
 *
 * <ul>
 *   <li>{@code default-max-pages} - pages per adapter when a request does not say (default 3)
 *   <li>{@code max-results-per-source} - cap applied by each adapter (default 10)
 *   <li>{@code adapter-threads} - size of the adapter worker pool (default 8)
 *   <li>{@code sources} - ordered source list; order is the merge tie-break
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "mass.scrape")
public class ScrapeProperties {

  private int defaultMaxPages = 3;
  private int maxResultsPerSource = 10;
  private int adapterThreads = 8;
  private List<SourceDefinition> sources = new ArrayList<>(defaultSources());

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultMaxPages < 1) {
      throw new IllegalStateException(
          "mass.scrape.default-max-pages must be >= 1, got: " + defaultMaxPages);
    }
    if (maxResultsPerSource < 1) {
      throw new IllegalStateException(
          "mass.scrape.max-results-per-source must be >= 1, got: " + maxResultsPerSource);
    }
    if (adapterThreads < 1) {
      throw new IllegalStateException(
          "mass.scrape.adapter-threads must be >= 1, got: " + adapterThreads);
    }
  }

  static List<SourceDefinition> defaultSources() {
    return List.of(
        new SourceDefinition(
            "google", SourceType.BROWSER, true, "https://www.google.com/search?q="),
        new SourceDefinition(
            "duckduckgo", SourceType.BROWSER, true, "https://duckduckgo.com/?q="),
        new SourceDefinition("firecrawl", SourceType.FIRECRAWL, true, null));
  }

  public int getDefaultMaxPages() {
    return defaultMaxPages;
  }

  public void setDefaultMaxPages(int defaultMaxPages) {
    this.defaultMaxPages = defaultMaxPages;
  }

  public int getMaxResultsPerSource() {
    return maxResultsPerSource;
  }

  public void setMaxResultsPerSource(int maxResultsPerSource) {
    this.maxResultsPerSource = maxResultsPerSource;
  }

  public int getAdapterThreads() {
    return adapterThreads;
  }

  public void setAdapterThreads(int adapterThreads) {
    this.adapterThreads = adapterThreads;
  }

  public List<SourceDefinition> getSources() {
    return sources;
  }

  public void setSources(List<SourceDefinition> sources) {
    this.sources = sources;
  }

  /** Kind of adapter a source definition instantiates. */
  public enum SourceType {
    BROWSER,
    FIRECRAWL
  }

  /**
   * One configured source.
   *
   * @param name adapter identity, also the {@code source} tag on its items
   * @param type which adapter family to build
   * @param enabled disabled sources are never constructed
   * @param searchUrl search-engine base URL the keywords are appended to (browser sources only)
   */
  public record SourceDefinition(
      String name, SourceType type, boolean enabled, @Nullable String searchUrl) {}
}
