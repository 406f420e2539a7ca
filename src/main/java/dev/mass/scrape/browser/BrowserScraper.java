package dev.mass.scrape.browser;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import dev.mass.scrape.ResultItem;
import dev.mass.scrape.SourceAdapter;
import dev.mass.scrape.UrlNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source adapter driving a headless browser against a search engine results page, or directly
 * against a target domain.
 *
 * <p>For each page up to {@code maxPages}: wait for the page to settle, extract results with the
 * {@link SelectorProfile} matching the current host, then try the profile's pagination controls in
 * order. A page with no matching control is treated as the last one. Failures are logged and end
 * the call with whatever was collected so far.
 */
public class BrowserScraper implements SourceAdapter {

  private static final Logger log = LoggerFactory.getLogger(BrowserScraper.class);

  static final String NO_TITLE = "No title";

  private final String name;
  private final String searchBaseUrl;
  private final int maxResults;
  private final BrowserLauncher launcher;
  private final BrowserProperties properties;

  public BrowserScraper(
      String name,
      String searchBaseUrl,
      int maxResults,
      BrowserLauncher launcher,
      BrowserProperties properties) {
    if (searchBaseUrl == null || searchBaseUrl.isBlank()) {
      throw new IllegalStateException("No search URL configured for browser source " + name);
    }
    this.name = name;
    this.searchBaseUrl = searchBaseUrl;
    this.maxResults = maxResults;
    this.launcher = launcher;
    this.properties = properties;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<ResultItem> scrape(String keywords, @Nullable String targetDomain, int maxPages) {
    log.info("[{}] Starting browser scraping for: {}", name, keywords);
    String url = buildTargetUrl(keywords, targetDomain);
    List<ResultItem> results = new ArrayList<>();

    try (BrowserSession session = launcher.open()) {
      Page page = session.newPage();
      page.navigate(url, new Page.NavigateOptions().setTimeout(properties.navigationTimeoutMs()));
      log.info("[{}] Navigated to {}", name, url);

      for (int pageNum = 1; pageNum <= maxPages; pageNum++) {
        log.info("[{}] Scraping page {} of {}", name, pageNum, maxPages);
        settle(page);
        results.addAll(extractPageData(page, pageNum, targetDomain));

        if (pageNum >= maxPages || results.size() >= maxResults) {
          break;
        }
        if (!navigateToNextPage(page)) {
          log.info("[{}] No more pages available", name);
          break;
        }
      }
    } catch (RuntimeException e) {
      log.error("[{}] Error during browser scraping: {}", name, e.getMessage());
    }

    return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : results;
  }

  String buildTargetUrl(String keywords, @Nullable String targetDomain) {
    if (targetDomain != null && !targetDomain.isBlank()) {
      return UrlNormalizer.withScheme(targetDomain);
    }
    return UrlNormalizer.searchUrl(searchBaseUrl, keywords);
  }

  List<ResultItem> extractPageData(Page page, int pageNum, @Nullable String targetDomain) {
    String pageUrl = page.url();
    SelectorProfile profile = SelectorProfile.forHost(UrlNormalizer.hostOf(pageUrl));
    try {
      if (profile.resultContainer() != null) {
        page.waitForSelector(
            profile.resultContainer(),
            new Page.WaitForSelectorOptions().setTimeout(properties.selectorTimeoutMs()));
      }
      List<ResultItem> extracted =
          profile.isGeneric()
              ? extractAnchors(page, pageUrl, profile, pageNum, targetDomain)
              : extractResultItems(page, profile, pageNum, targetDomain);
      log.info("[{}] Extracted {} items from page {}", name, extracted.size(), pageNum);
      return extracted;
    } catch (PlaywrightException e) {
      log.error("[{}] Error extracting data from page {}: {}", name, pageNum, e.getMessage());
      return List.of();
    }
  }

  private List<ResultItem> extractAnchors(
      Page page,
      String pageUrl,
      SelectorProfile profile,
      int pageNum,
      @Nullable String targetDomain) {
    List<ResultItem> results = new ArrayList<>();
    for (ElementHandle anchor : page.querySelectorAll(profile.link())) {
      try {
        String href = anchor.getAttribute("href");
        if (href == null || href.isBlank() || href.startsWith("#") || href.startsWith("javascript")) {
          continue;
        }
        href = UrlNormalizer.absolutize(pageUrl, href);
        if (!matchesDomain(href, targetDomain)) {
          continue;
        }
        String text = anchor.textContent();
        String title = text == null || text.isBlank() ? NO_TITLE : text.strip();
        results.add(format(raw(title, href, "", pageNum), null));
      } catch (PlaywrightException e) {
        log.debug("[{}] Error processing link: {}", name, e.getMessage());
      }
    }
    return results;
  }

  private List<ResultItem> extractResultItems(
      Page page, SelectorProfile profile, int pageNum, @Nullable String targetDomain) {
    List<ResultItem> results = new ArrayList<>();
    for (ElementHandle item : page.querySelectorAll(profile.resultItems())) {
      try {
        String title = textOf(item, profile.title());
        ElementHandle linkElement = item.querySelector(profile.link());
        String link = linkElement != null ? linkElement.getAttribute("href") : null;
        if (link == null || !matchesDomain(link, targetDomain)) {
          continue;
        }
        String description = textOf(item, profile.description());
        results.add(
            format(raw(title.isEmpty() ? NO_TITLE : title, link, description, pageNum), null));
      } catch (PlaywrightException e) {
        log.debug("[{}] Error processing result item: {}", name, e.getMessage());
      }
    }
    return results;
  }

  boolean navigateToNextPage(Page page) {
    SelectorProfile profile = SelectorProfile.forHost(UrlNormalizer.hostOf(page.url()));
    try {
      if (clickFirstMatch(page, profile.nextPage())) {
        return true;
      }
      return clickFirstMatch(page, profile.loadMore());
    } catch (PlaywrightException e) {
      log.debug("[{}] No next page available: {}", name, e.getMessage());
      return false;
    }
  }

  private boolean clickFirstMatch(Page page, List<String> candidates) {
    for (String selector : candidates) {
      ElementHandle control = page.querySelector(selector);
      if (control != null) {
        control.click();
        page.waitForLoadState(LoadState.NETWORKIDLE);
        return true;
      }
    }
    return false;
  }

  private void settle(Page page) {
    if (properties.settleDelayMs() > 0) {
      page.waitForTimeout(properties.settleDelayMs());
    }
  }

  private static String textOf(ElementHandle parent, @Nullable String selector) {
    if (selector == null) {
      return "";
    }
    ElementHandle element = parent.querySelector(selector);
    if (element == null) {
      return "";
    }
    String text = element.textContent();
    return text == null ? "" : text.strip();
  }

  private static boolean matchesDomain(String link, @Nullable String targetDomain) {
    return targetDomain == null || targetDomain.isBlank() || link.contains(targetDomain.trim());
  }

  private static Map<String, Object> raw(
      String title, String link, String description, int pageNum) {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("title", title);
    raw.put("link", link);
    raw.put("thumbnail", "");
    raw.put("description", description);
    raw.put("page_number", pageNum);
    return raw;
  }
}
