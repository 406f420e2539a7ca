package dev.mass.batch;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mass.registry.LinkRegistry;
import dev.mass.scrape.UrlNormalizer;
import dev.mass.scrape.firecrawl.ExtractPayloads;
import dev.mass.scrape.firecrawl.FirecrawlClient;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Offline extraction of one domain into three categories: references, videos and links.
 *
 * <p>Each category calls the extraction service, drops URLs another registrant already owns in the
 * {@link LinkRegistry}, registers the rest, and writes its own artifact. A combined artifact with
 * totals is written at the end.
 */
@Service
public class BatchExtractionService {

  private static final Logger log = LoggerFactory.getLogger(BatchExtractionService.class);

  static final String REFERENCES = "references";
  static final String VIDEOS = "videos";
  static final String LINKS = "links";
  static final String COMBINED = "combined";

  private final FirecrawlClient client;
  private final LinkRegistry registry;
  private final ArtifactWriter writer;
  private final BatchProperties properties;
  private final Clock clock;

  public BatchExtractionService(
      FirecrawlClient client,
      LinkRegistry registry,
      ArtifactWriter writer,
      BatchProperties properties,
      Clock clock) {
    this.client = client;
    this.registry = registry;
    this.writer = writer;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Runs all three categories in sequence and writes the combined artifact.
   *
   * @param keyword the topic to extract
   * @param domain target domain, with or without scheme
   * @param pages number of link pages to extract, at least 1
   * @return the combined report
   */
  public BatchReport extractAll(String keyword, String domain, int pages) {
    if (keyword == null || keyword.isBlank()) {
      throw new IllegalArgumentException("Keyword must not be blank");
    }
    if (domain == null || domain.isBlank()) {
      throw new IllegalArgumentException("Domain must not be blank");
    }
    if (pages < 1) {
      throw new IllegalArgumentException("pages must be at least 1");
    }
    log.info("Starting batch extraction for '{}' on {}", keyword, domain);

    CategoryResult references = extractReferences(keyword, domain);
    CategoryResult videos = extractVideos(keyword, domain);
    CategoryResult links = extractLinks(keyword, domain, pages);

    BatchReport report =
        BatchReport.of(keyword, domain, clock.instant(), references, videos, links);
    save(COMBINED, keyword, domain, report);
    log.info(
        "Batch extraction finished: {} references, {} videos, {} links",
        report.stats().totalReferences(),
        report.stats().totalVideos(),
        report.stats().totalLinks());
    return report;
  }

  CategoryResult extractReferences(String keyword, String domain) {
    Map<String, String> item = new LinkedHashMap<>();
    item.put("title", "Title of the reference");
    item.put("content", "Content of the reference");
    item.put("url", "URL of the reference");
    item.put("thumbnail_url", "Thumbnail image URL if available");
    String prompt =
        ("Extract all references and content related to %s. Ensure that the title, content, and"
                + " thumbnail images (if available) are included for each reference.")
            .formatted(keyword);
    return extractCategory(REFERENCES, keyword, domain, prompt, item, List.of("title", "content"));
  }

  CategoryResult extractVideos(String keyword, String domain) {
    Map<String, String> item = new LinkedHashMap<>();
    item.put("title", "Title of the video");
    item.put("url", "URL of the video");
    item.put("thumbnail_url", "Thumbnail image URL if available");
    item.put("duration", "Duration if available");
    item.put("views", "View count if available");
    item.put("upload_date", "Upload date if available");
    String prompt =
        ("Extract all videos that include the keyword \"%s\" in the page content. For each,"
                + " include title, URL, thumbnail image URL, duration, views, and upload date.")
            .formatted(keyword);
    return extractCategory(VIDEOS, keyword, domain, prompt, item, List.of("title", "url"));
  }

  private CategoryResult extractCategory(
      String category,
      String keyword,
      String domain,
      String prompt,
      Map<String, String> item,
      List<String> required) {
    logRegistrySize(category);
    JsonNode data =
        client.extract(
            List.of(wildcard(domain)),
            prompt,
            ExtractPayloads.arraySchema(category, item, required),
            false);
    List<Map<String, Object>> extracted = ExtractPayloads.records(data, category, "url");
    List<Map<String, Object>> kept = keepNew(extracted, "url");

    CategoryResult result = new CategoryResult(category, extracted.size(), kept);
    logCounts(category, result);
    save(category, keyword, domain, result);
    return result;
  }

  CategoryResult extractLinks(String keyword, String domain, int pages) {
    logRegistrySize(LINKS);
    String base = UrlNormalizer.withScheme(domain.trim());
    List<LinkStrategy> strategies = linkStrategies(keyword, base);

    Set<String> seen = new HashSet<>();
    List<Map<String, Object>> kept = new ArrayList<>();
    int extracted = 0;
    for (int page = 1; page <= pages; page++) {
      LinkStrategy strategy = strategies.get(Math.min(page - 1, strategies.size() - 1));
      log.info("Extracting links page {} from {}", page, strategy.url());

      List<Map<String, Object>> records = extractLinkPage(strategy.url(), strategy.prompt());
      if (records == null) {
        log.warn("Link page {} failed, trying fallback", page);
        String fallbackUrl = base + (base.contains("?") ? "&" : "?") + "page=" + page;
        String prompt =
            "Extract any links related to '%s' from page %d that haven't been seen yet."
                .formatted(keyword, page);
        records = extractLinkPage(fallbackUrl, prompt);
        if (records == null) {
          log.warn("Fallback for link page {} also failed", page);
          records = List.of();
        }
      }

      List<Map<String, Object>> unique = new ArrayList<>();
      for (Map<String, Object> record : records) {
        Object link = record.get("link");
        if (link != null && !link.toString().isBlank() && seen.add(link.toString())) {
          record.put("page_number", page);
          unique.add(record);
        }
      }
      extracted += unique.size();
      List<Map<String, Object>> fresh = keepNew(unique, "link");
      kept.addAll(fresh);
      log.info("Found {} unique links on page {}, {} new", unique.size(), page, fresh.size());

      if (page < pages && !pause()) {
        break;
      }
    }

    CategoryResult result = new CategoryResult(LINKS, extracted, kept);
    logCounts(LINKS, result);
    save(LINKS, keyword, domain, result);
    return result;
  }

  /** Returns the page's records, or {@code null} when the extraction produced no payload. */
  private @Nullable List<Map<String, Object>> extractLinkPage(String url, String prompt) {
    Map<String, String> item = new LinkedHashMap<>();
    item.put("title", "The title of the linked content");
    item.put("link", "The URL of the linked content");
    item.put("source", "The source or origin of the link");
    try {
      JsonNode data =
          client.extract(
              List.of(url),
              prompt,
              ExtractPayloads.arraySchema(
                  ExtractPayloads.RESULTS_FIELD, item, List.of("title", "link", "source")),
              false);
      if (data.isMissingNode()) {
        return null;
      }
      return ExtractPayloads.records(data, ExtractPayloads.RESULTS_FIELD, "link");
    } catch (RuntimeException e) {
      log.error("Error extracting links from {}: {}", url, e.getMessage());
      return null;
    }
  }

  static List<LinkStrategy> linkStrategies(String keyword, String base) {
    String root = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    String query = URLEncoder.encode(keyword, StandardCharsets.UTF_8);
    return List.of(
        new LinkStrategy(
            base,
            ("Extract all links related to '%s' from the homepage. Focus on primary navigation"
                    + " links and important sections.")
                .formatted(keyword)),
        new LinkStrategy(
            root + "/search?q=" + query,
            "Extract all links related to '%s' from search results. Find links that weren't on the homepage."
                .formatted(keyword)),
        new LinkStrategy(
            root + "/blog",
            "Extract all blog posts or news articles related to '%s'. Find recent content links."
                .formatted(keyword)),
        new LinkStrategy(
            root + "/about",
            "Extract all team, company, or about-related links that mention '%s'."
                .formatted(keyword)));
  }

  /** One link-page extraction: where to look and what to ask for. */
  record LinkStrategy(String url, String prompt) {}

  private List<Map<String, Object>> keepNew(List<Map<String, Object>> records, String linkKey) {
    List<String> urls =
        records.stream()
            .map(record -> record.get(linkKey))
            .filter(value -> value != null && !value.toString().isBlank())
            .map(Object::toString)
            .distinct()
            .toList();
    Set<String> fresh = new HashSet<>(registry.filterNew(urls, properties.registrant()));
    registry.register(List.copyOf(fresh), properties.registrant());
    return records.stream()
        .filter(record -> record.get(linkKey) != null && fresh.contains(record.get(linkKey).toString()))
        .toList();
  }

  static String wildcard(String domain) {
    String url = UrlNormalizer.withScheme(domain.trim());
    if (url.endsWith("*")) {
      return url;
    }
    return url.endsWith("/") ? url + "*" : url + "/*";
  }

  private void save(String category, String keyword, String domain, Object payload) {
    try {
      log.info("Output saved to: {}", writer.write(category, keyword, domain, payload));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + category + " artifact", e);
    }
  }

  private void logRegistrySize(String category) {
    log.info("[{}] Link registry holds {} links", category, registry.stats().totalLinks());
  }

  private static void logCounts(String category, CategoryResult result) {
    log.info(
        "[{}] extracted {}, new {}, filtered out {}",
        category,
        result.extracted(),
        result.items().size(),
        result.filteredOut());
  }

  private boolean pause() {
    if (properties.pageDelayMs() <= 0) {
      return true;
    }
    try {
      Thread.sleep(properties.pageDelayMs());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
