package dev.mass.config;

import dev.mass.scrape.ScrapeProperties;
import dev.mass.scrape.ScrapeProperties.SourceDefinition;
import dev.mass.scrape.SourceAdapter;
import dev.mass.scrape.browser.BrowserLauncher;
import dev.mass.scrape.browser.BrowserProperties;
import dev.mass.scrape.browser.BrowserScraper;
import dev.mass.scrape.firecrawl.FirecrawlClient;
import dev.mass.scrape.firecrawl.FirecrawlProperties;
import dev.mass.scrape.firecrawl.FirecrawlScraper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the active adapter list from {@code mass.scrape.sources}.
 *
 * <p>A source whose construction fails (a missing credential, an unset type) is logged once and
 * left out; the remaining sources still run.
 */
@Component
public class SourceAdapterFactory {

  private static final Logger log = LoggerFactory.getLogger(SourceAdapterFactory.class);

  private final ScrapeProperties scrapeProperties;
  private final BrowserLauncher browserLauncher;
  private final BrowserProperties browserProperties;
  private final FirecrawlClient firecrawlClient;
  private final FirecrawlProperties firecrawlProperties;

  public SourceAdapterFactory(
      ScrapeProperties scrapeProperties,
      BrowserLauncher browserLauncher,
      BrowserProperties browserProperties,
      FirecrawlClient firecrawlClient,
      FirecrawlProperties firecrawlProperties) {
    this.scrapeProperties = scrapeProperties;
    this.browserLauncher = browserLauncher;
    this.browserProperties = browserProperties;
    this.firecrawlClient = firecrawlClient;
    this.firecrawlProperties = firecrawlProperties;
  }

  /** Instantiates every enabled source in configuration order. */
  public List<SourceAdapter> createAdapters() {
    List<SourceAdapter> adapters = new ArrayList<>();
    for (SourceDefinition source : scrapeProperties.getSources()) {
      if (!source.enabled()) {
        log.info("Source {} is disabled", source.name());
        continue;
      }
      try {
        adapters.add(create(source));
      } catch (RuntimeException e) {
        log.warn("Source {} not initialized: {}", source.name(), e.toString());
      }
    }
    return adapters;
  }

  SourceAdapter create(SourceDefinition source) {
    int cap = scrapeProperties.getMaxResultsPerSource();
    return switch (source.type()) {
      case BROWSER ->
          new BrowserScraper(
              source.name(), source.searchUrl(), cap, browserLauncher, browserProperties);
      case FIRECRAWL ->
          new FirecrawlScraper(source.name(), firecrawlClient, firecrawlProperties, cap);
    };
  }
}
