package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mass.scrape.ResultItem;
import dev.mass.scrape.SourceAdapter;
import dev.mass.scrape.UrlNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source adapter backed by the Firecrawl extraction service.
 *
 * <p>With a target domain the site is crawled and pages mentioning any keyword are returned. Without
 * one, the keywords are sent through several extraction prompts, one per simulated page, and the
 * union of their results is returned with duplicates across prompts removed.
 */
public class FirecrawlScraper implements SourceAdapter {

  private static final Logger log = LoggerFactory.getLogger(FirecrawlScraper.class);

  static final String UNTITLED_PAGE = "Untitled Page";

  private final String name;
  private final FirecrawlClient client;
  private final FirecrawlProperties properties;
  private final int maxResults;

  public FirecrawlScraper(
      String name, FirecrawlClient client, FirecrawlProperties properties, int maxResults) {
    if (!properties.hasApiKey()) {
      throw new IllegalStateException(
          "No Firecrawl API key configured (mass.firecrawl.api-key), source " + name + " disabled");
    }
    this.name = name;
    this.client = client;
    this.properties = properties;
    this.maxResults = maxResults;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<ResultItem> scrape(String keywords, @Nullable String targetDomain, int maxPages) {
    try {
      List<ResultItem> results =
          targetDomain != null && !targetDomain.isBlank()
              ? crawlDomain(targetDomain.trim(), keywords, maxPages)
              : extractContent(keywords, maxPages);
      return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : results;
    } catch (RuntimeException e) {
      log.error("[{}] Error during Firecrawl scraping: {}", name, e.getMessage());
      return List.of();
    }
  }

  List<ResultItem> crawlDomain(String domain, String keywords, int maxPages) {
    String url = UrlNormalizer.withScheme(domain);
    log.info("[{}] Crawling domain {} with keywords: {}", name, url, keywords);

    List<FirecrawlDocument> pages = client.crawl(url, maxPages * 10);
    List<String> terms = terms(keywords);
    int examined = Math.min(pages.size(), maxPages * 5);
    int cap = maxPages * 3;

    List<ResultItem> results = new ArrayList<>();
    for (int i = 0; i < examined && results.size() < cap; i++) {
      FirecrawlDocument page = pages.get(i);
      if (!terms.isEmpty() && !mentionsAny(page.markdown(), terms)) {
        continue;
      }
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("title", page.title() != null && !page.title().isBlank() ? page.title() : UNTITLED_PAGE);
      raw.put("link", page.pageUrl() != null ? page.pageUrl() : "");
      raw.put("thumbnail", "");
      raw.put("description", page.description());
      raw.put("page_number", i + 1);
      results.add(format(raw, null));
    }
    log.info("[{}] Crawl of {} kept {} of {} pages", name, url, results.size(), pages.size());
    return results;
  }

  List<ResultItem> extractContent(String query, int maxPages) {
    List<String> prompts = ExtractStrategies.promptsFor(query, maxPages);
    log.info("[{}] Extracting content for '{}' across {} prompts", name, query, prompts.size());

    List<ResultItem> results = new ArrayList<>();
    Set<String> seenLinks = new HashSet<>();
    for (int i = 0; i < prompts.size(); i++) {
      int pageNum = i + 1;
      String prompt = prompts.get(i);
      try {
        log.info("[{}] Extracting page {} with prompt: {}", name, pageNum, prompt);
        JsonNode data = client.extract(List.of(), prompt, ExtractPayloads.schema(), true);
        for (Map<String, Object> record : ExtractPayloads.toRecords(data)) {
          if (!seenLinks.add(String.valueOf(record.get("link")))) {
            continue;
          }
          record.put("page_number", pageNum);
          results.add(format(record, null));
        }
      } catch (RuntimeException e) {
        log.error("[{}] Error extracting page {}: {}", name, pageNum, e.getMessage());
      }
      if (pageNum < prompts.size() && !pause()) {
        break;
      }
    }
    log.info("[{}] Extracted {} results across {} prompts", name, results.size(), prompts.size());
    return results;
  }

  private boolean pause() {
    if (properties.strategyDelayMs() <= 0) {
      return true;
    }
    try {
      Thread.sleep(properties.strategyDelayMs());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static List<String> terms(String keywords) {
    if (keywords == null || keywords.isBlank()) {
      return List.of();
    }
    return List.of(keywords.trim().toLowerCase(Locale.ROOT).split("\\s+"));
  }

  private static boolean mentionsAny(@Nullable String content, List<String> terms) {
    if (content == null) {
      return false;
    }
    String haystack = content.toLowerCase(Locale.ROOT);
    return terms.stream().anyMatch(haystack::contains);
  }
}
