package dev.mass.scrape.browser;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CSS/Playwright selectors used to read one kind of results page.
 *
 * <p>The {@link #GENERIC} profile has no result structure: it collects every anchor on the page.
 * Site profiles describe a result list (container, item, title, link, description). Pagination
 * candidates are tried in order; the first match is clicked.
 *
 * @param key profile identifier
 * @param resultContainer element awaited before extraction, {@code null} for none
 * @param resultItems selector for one result entry, {@code null} for the generic profile
 * @param title title selector relative to a result entry
 * @param link link selector relative to a result entry (or the page, for generic)
 * @param description description selector relative to a result entry
 * @param nextPage ordered candidate selectors for a "next page" control
 * @param loadMore ordered candidate selectors for a "load more" control, tried after nextPage
 */
public record SelectorProfile(
    String key,
    @Nullable String resultContainer,
    @Nullable String resultItems,
    @Nullable String title,
    String link,
    @Nullable String description,
    List<String> nextPage,
    List<String> loadMore) {

  public SelectorProfile {
    nextPage = nextPage == null ? List.of() : List.copyOf(nextPage);
    loadMore = loadMore == null ? List.of() : List.copyOf(loadMore);
  }

  public static final SelectorProfile GENERIC =
      new SelectorProfile(
          "generic",
          null,
          null,
          null,
          "a[href]",
          null,
          List.of("a:has-text(\"Next\")", "a.next", "a.pagination-next", "a[rel=\"next\"]"),
          List.of("button:has-text(\"Load more\")", "button:has-text(\"Show more\")"));

  public static final SelectorProfile GOOGLE =
      new SelectorProfile(
          "google", "#search", ".g", "h3", "a[href]", ".VwiC3b", List.of("#pnnext"), List.of());

  public static final SelectorProfile DUCKDUCKGO =
      new SelectorProfile(
          "duckduckgo",
          ".results",
          ".result",
          ".result__title",
          ".result__title a[href]",
          ".result__snippet",
          List.of(".result--more"),
          List.of());

  /** True for the anchor-harvesting profile used on unknown sites. */
  public boolean isGeneric() {
    return resultItems == null;
  }

  /**
   * Picks the profile matching the host of the page currently displayed.
   *
   * @param host lowercased host name
   * @return a site profile, or {@link #GENERIC} for unknown hosts
   */
  public static SelectorProfile forHost(String host) {
    if (host.contains("google.com")) {
      return GOOGLE;
    }
    if (host.contains("duckduckgo.com")) {
      return DUCKDUCKGO;
    }
    return GENERIC;
  }
}
